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

/**
 * Binary operators with their precedence (higher binds tighter) and
 * associativity. All operators are left-associative except
 * {@link #POWER}, which is right-associative: {@code 2 ** 3 ** 2} is
 * {@code 2 ** (3 ** 2)}.
 */
public enum BinaryOperator {
	OR("OR", 1),
	XOR("XOR", 2),
	AND("AND", 3),
	EQUAL("=", 4),
	NOT_EQUAL("<>", 4),
	LESS("<", 5),
	LESS_EQUAL("<=", 5),
	GREATER(">", 5),
	GREATER_EQUAL(">=", 5),
	ADD("+", 6),
	SUBTRACT("-", 6),
	MULTIPLY("*", 7),
	DIVIDE("/", 7),
	MODULO("MOD", 7),
	POWER("**", 8);

	/** Precedence of the loosest binary operator */
	public static final int LOWEST_PRECEDENCE = 1;

	private final String symbol;
	private final int precedence;

	BinaryOperator(String symbol, int precedence) {
		this.symbol = symbol;
		this.precedence = precedence;
	}

	public String getSymbol() {
		return symbol;
	}

	public int getPrecedence() {
		return precedence;
	}

	public boolean isRightAssociative() {
		return this == POWER;
	}

	/**
	 * Short-circuit operators add one decision each to a condition.
	 *
	 * @return {@code true} for AND and OR
	 */
	public boolean isShortCircuit() {
		return this == AND || this == OR;
	}
}
