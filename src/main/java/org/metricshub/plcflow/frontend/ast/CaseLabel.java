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
 * One selector value of a {@code CASE} arm, or an inclusive range
 * {@code low..high}.
 */
public final class CaseLabel extends AstNode {

	private final Expression low;
	private final Expression high;

	public CaseLabel(Expression low, Expression high, SourceSpan span) {
		super(span);
		this.low = low;
		this.high = high;
	}

	/**
	 * @return the single value, or the lower bound of the range
	 */
	public Expression getLow() {
		return low;
	}

	/**
	 * @return the upper bound of the range, {@code null} for a single value
	 */
	public Expression getHigh() {
		return high;
	}

	public boolean isRange() {
		return high != null;
	}

	@Override
	public String toString() {
		return high == null ? low.toString() : low + ".." + high;
	}
}
