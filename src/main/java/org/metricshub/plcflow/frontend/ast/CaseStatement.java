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
 * {@code CASE selector OF arms [ELSE ...] END_CASE;}
 * The else body is {@code null} when there is no {@code ELSE}.
 */
public final class CaseStatement extends Statement {

	private final Expression selector;
	private final List<CaseArm> arms;
	private final List<Statement> elseBody;

	public CaseStatement(Expression selector, List<CaseArm> arms, List<Statement> elseBody, SourceSpan span) {
		super(span);
		this.selector = selector;
		this.arms = Collections.unmodifiableList(arms);
		this.elseBody = elseBody == null ? null : Collections.unmodifiableList(elseBody);
	}

	public Expression getSelector() {
		return selector;
	}

	public List<CaseArm> getArms() {
		return arms;
	}

	public List<Statement> getElseBody() {
		return elseBody;
	}

	public boolean hasElse() {
		return elseBody != null;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitCase(this);
	}

	@Override
	public String toString() {
		return "CASE " + selector;
	}
}
