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
 * {@code REPEAT ... UNTIL condition END_REPEAT;} The condition is
 * evaluated after the body.
 */
public final class RepeatStatement extends Statement {

	private final List<Statement> body;
	private final Expression condition;

	public RepeatStatement(List<Statement> body, Expression condition, SourceSpan span) {
		super(span);
		this.body = Collections.unmodifiableList(body);
		this.condition = condition;
	}

	public List<Statement> getBody() {
		return body;
	}

	public Expression getCondition() {
		return condition;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitRepeat(this);
	}

	@Override
	public String toString() {
		return "REPEAT UNTIL " + condition;
	}
}
