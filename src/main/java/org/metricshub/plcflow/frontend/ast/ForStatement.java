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
 * {@code FOR variable := start TO end [BY step] DO ... END_FOR;}
 */
public final class ForStatement extends Statement {

	private final String variable;
	private final Expression start;
	private final Expression end;
	private final Expression step;
	private final List<Statement> body;

	public ForStatement(
			String variable,
			Expression start,
			Expression end,
			Expression step,
			List<Statement> body,
			SourceSpan span) {
		super(span);
		this.variable = variable;
		this.start = start;
		this.end = end;
		this.step = step;
		this.body = Collections.unmodifiableList(body);
	}

	public String getVariable() {
		return variable;
	}

	public Expression getStart() {
		return start;
	}

	public Expression getEnd() {
		return end;
	}

	/**
	 * @return the step, {@code null} when there is no {@code BY} clause
	 */
	public Expression getStep() {
		return step;
	}

	public List<Statement> getBody() {
		return body;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitFor(this);
	}

	@Override
	public String toString() {
		return "FOR " + variable + " := " + start + " TO " + end + (step == null ? "" : " BY " + step);
	}
}
