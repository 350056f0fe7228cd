package org.metricshub.plcflow.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * PLC Flow
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 - 2026 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.plcflow.SourceSpan;

/**
 * A Program Organization Unit: function, function block or program.
 */
public final class Pou extends AstNode {

	private final PouKind kind;
	private final String name;
	private final TypeReference returnType;
	private final List<VariableBlock> variableBlocks;
	private final List<Statement> body;
	private final List<Pragma> pragmas;

	public Pou(
			PouKind kind,
			String name,
			TypeReference returnType,
			List<VariableBlock> variableBlocks,
			List<Statement> body,
			List<Pragma> pragmas,
			SourceSpan span) {
		super(span);
		this.kind = kind;
		this.name = name;
		this.returnType = returnType;
		this.variableBlocks = Collections.unmodifiableList(variableBlocks);
		this.body = Collections.unmodifiableList(body);
		this.pragmas = Collections.unmodifiableList(pragmas);
	}

	public PouKind getKind() {
		return kind;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the result type of a function, {@code null} otherwise
	 */
	public TypeReference getReturnType() {
		return returnType;
	}

	public List<VariableBlock> getVariableBlocks() {
		return variableBlocks;
	}

	/**
	 * @return every declaration of every variable block, in source order
	 */
	public List<VariableDeclaration> getDeclarations() {
		List<VariableDeclaration> all = new ArrayList<VariableDeclaration>();
		for (VariableBlock block : variableBlocks) {
			all.addAll(block.getDeclarations());
		}
		return all;
	}

	public List<Statement> getBody() {
		return body;
	}

	/**
	 * @return the pragmas placed before the POU header
	 */
	public List<Pragma> getPragmas() {
		return pragmas;
	}

	@Override
	public String toString() {
		return kind + " " + name;
	}
}
