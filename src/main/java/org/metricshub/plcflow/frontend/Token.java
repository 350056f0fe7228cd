package org.metricshub.plcflow.frontend;

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
 * One lexical token. Immutable.
 */
public final class Token {

	private final TokenType type;
	private final String text;
	private final Object value;
	private final SourceSpan span;

	/**
	 * @param type the token tag
	 * @param text the raw source text of the token
	 * @param value the literal payload ({@link Long}, {@link Double},
	 *        {@link String} or {@link Boolean}), {@code null} if none
	 * @param span where the token was read
	 */
	public Token(TokenType type, String text, Object value, SourceSpan span) {
		this.type = type;
		this.text = text;
		this.value = value;
		this.span = span;
	}

	public TokenType getType() {
		return type;
	}

	public String getText() {
		return text;
	}

	public Object getValue() {
		return value;
	}

	public SourceSpan getSpan() {
		return span;
	}

	/**
	 * @param expected the tag to compare with
	 * @return whether this token has the given tag
	 */
	public boolean is(TokenType expected) {
		return type == expected;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		if (type == TokenType.EOF) {
			return "end of input";
		}
		return type.name() + " '" + text + "'";
	}
}
