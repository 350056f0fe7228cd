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
 * One declaration line. {@code a, b : INT := 5;} is a single declaration
 * holding both names, its type and its initial value.
 */
public final class VariableDeclaration extends AstNode {

	private final List<String> names;
	private final VariableClass variableClass;
	private final boolean constant;
	private final TypeReference type;
	private final Expression initialValue;
	private final DirectAddress location;
	private final List<Pragma> pragmas;

	public VariableDeclaration(
			List<String> names,
			VariableClass variableClass,
			boolean constant,
			TypeReference type,
			Expression initialValue,
			DirectAddress location,
			List<Pragma> pragmas,
			SourceSpan span) {
		super(span);
		this.names = Collections.unmodifiableList(new ArrayList<String>(names));
		this.variableClass = variableClass;
		this.constant = constant;
		this.type = type;
		this.initialValue = initialValue;
		this.location = location;
		this.pragmas = Collections.unmodifiableList(pragmas);
	}

	/**
	 * @return the declared names, in source order
	 */
	public List<String> getNames() {
		return names;
	}

	public VariableClass getVariableClass() {
		return variableClass;
	}

	public boolean isConstant() {
		return constant;
	}

	public TypeReference getType() {
		return type;
	}

	/**
	 * @return the initial value, {@code null} if none
	 */
	public Expression getInitialValue() {
		return initialValue;
	}

	/**
	 * @return the {@code AT} location, {@code null} if none
	 */
	public DirectAddress getLocation() {
		return location;
	}

	public List<Pragma> getPragmas() {
		return pragmas;
	}

	@Override
	public String toString() {
		return String.join(", ", names) + " : " + type;
	}
}
