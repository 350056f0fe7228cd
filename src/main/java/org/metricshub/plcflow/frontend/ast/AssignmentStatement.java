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

import org.metricshub.plcflow.SourceSpan;

/**
 * {@code target := value;} (or a compound assignment).
 */
public final class AssignmentStatement extends Statement {

	private final Expression target;
	private final AssignmentOperator operator;
	private final Expression value;

	public AssignmentStatement(Expression target, AssignmentOperator operator, Expression value, SourceSpan span) {
		super(span);
		this.target = target;
		this.operator = operator;
		this.value = value;
	}

	public Expression getTarget() {
		return target;
	}

	public AssignmentOperator getOperator() {
		return operator;
	}

	public Expression getValue() {
		return value;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitAssignment(this);
	}

	@Override
	public String toString() {
		return target + " " + operator.getSymbol() + " " + value;
	}
}
