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
 * One argument of a call. The value is {@code null} for the empty
 * arguments of the vendor dialect ({@code F(a, , b)}).
 */
public final class Argument extends AstNode {

	private final String name;
	private final ArgumentKind kind;
	private final Expression value;

	public Argument(String name, ArgumentKind kind, Expression value, SourceSpan span) {
		super(span);
		this.name = name;
		this.kind = kind;
		this.value = value;
	}

	/**
	 * @return the formal parameter name, {@code null} for positional arguments
	 */
	public String getName() {
		return name;
	}

	public ArgumentKind getKind() {
		return kind;
	}

	public Expression getValue() {
		return value;
	}

	public boolean isEmpty() {
		return value == null;
	}

	@Override
	public String toString() {
		String rendered = value == null ? "" : value.toString();
		switch (kind) {
		case INPUT:
			return name + " := " + rendered;
		case OUTPUT:
			return name + " => " + rendered;
		default:
			return rendered;
		}
	}
}
