package org.metricshub.plcflow.limits;

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

/**
 * The resource ceilings a parse can run into.
 */
public enum LimitKind {
	INPUT_TOO_LARGE("max input size"),
	DEPTH_EXCEEDED("max nesting depth"),
	ITERATION_EXCEEDED("max iterations"),
	COLLECTION_TOO_LARGE("max collection size"),
	STRING_TOO_LONG("max string length"),
	STATEMENT_LIMIT_EXCEEDED("max statements");

	private final String ceilingName;

	LimitKind(String ceilingName) {
		this.ceilingName = ceilingName;
	}

	/**
	 * @return the human readable name of the ceiling that was reached
	 */
	public String getCeilingName() {
		return ceilingName;
	}
}
