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
 * Function, function block or method call.
 */
public final class CallExpression extends Expression {

	private final Expression callee;
	private final List<Argument> arguments;

	public CallExpression(Expression callee, List<Argument> arguments, SourceSpan span) {
		super(span);
		this.callee = callee;
		this.arguments = Collections.unmodifiableList(arguments);
	}

	public Expression getCallee() {
		return callee;
	}

	public List<Argument> getArguments() {
		return arguments;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitCall(this);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder().append(callee).append('(');
		for (int i = 0; i < arguments.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(arguments.get(i));
		}
		return sb.append(')').toString();
	}
}
