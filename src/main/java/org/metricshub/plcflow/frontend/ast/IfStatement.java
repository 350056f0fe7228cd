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
 * {@code IF c1 THEN ... ELSIF c2 THEN ... ELSE ... END_IF;}
 * <p>
 * The first conditional block is the {@code IF}, the others are the
 * {@code ELSIF}s. The else body is {@code null} when there is no
 * {@code ELSE}.
 */
public final class IfStatement extends Statement {

	private final List<ConditionalBlock> branches;
	private final List<Statement> elseBody;

	public IfStatement(List<ConditionalBlock> branches, List<Statement> elseBody, SourceSpan span) {
		super(span);
		if (branches.isEmpty()) {
			throw new IllegalArgumentException("IF requires at least one condition");
		}
		this.branches = Collections.unmodifiableList(branches);
		this.elseBody = elseBody == null ? null : Collections.unmodifiableList(elseBody);
	}

	public List<ConditionalBlock> getBranches() {
		return branches;
	}

	public List<Statement> getElseBody() {
		return elseBody;
	}

	public boolean hasElse() {
		return elseBody != null;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitIf(this);
	}

	@Override
	public String toString() {
		return "IF " + branches.get(0).getCondition();
	}
}
