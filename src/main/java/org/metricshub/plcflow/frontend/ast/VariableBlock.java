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

import java.util.Collections;
import java.util.List;
import org.metricshub.plcflow.SourceSpan;

/**
 * {@code VAR_xxx [CONSTANT] [RETAIN | NON_RETAIN] ... END_VAR}
 */
public final class VariableBlock extends AstNode {

	private final VariableClass variableClass;
	private final boolean constant;
	private final RetainKind retain;
	private final List<VariableDeclaration> declarations;
	private final List<Pragma> pragmas;

	public VariableBlock(
			VariableClass variableClass,
			boolean constant,
			RetainKind retain,
			List<VariableDeclaration> declarations,
			List<Pragma> pragmas,
			SourceSpan span) {
		super(span);
		this.variableClass = variableClass;
		this.constant = constant;
		this.retain = retain;
		this.declarations = Collections.unmodifiableList(declarations);
		this.pragmas = Collections.unmodifiableList(pragmas);
	}

	public VariableClass getVariableClass() {
		return variableClass;
	}

	public boolean isConstant() {
		return constant;
	}

	public RetainKind getRetain() {
		return retain;
	}

	public List<VariableDeclaration> getDeclarations() {
		return declarations;
	}

	public List<Pragma> getPragmas() {
		return pragmas;
	}
}
