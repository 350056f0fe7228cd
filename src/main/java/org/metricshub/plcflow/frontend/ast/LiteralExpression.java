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
 * A literal value. The value is a {@link Long} for integers, a
 * {@link Double} for reals, a {@link Boolean} for booleans and a
 * {@link String} otherwise (the text after {@code #} for time and date
 * literals, the decoded content for strings).
 */
public final class LiteralExpression extends Expression {

	private final LiteralKind kind;
	private final String text;
	private final Object value;

	public LiteralExpression(LiteralKind kind, String text, Object value, SourceSpan span) {
		super(span);
		this.kind = kind;
		this.text = text;
		this.value = value;
	}

	public LiteralKind getKind() {
		return kind;
	}

	/**
	 * @return the literal as written in the source
	 */
	public String getText() {
		return text;
	}

	public Object getValue() {
		return value;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitLiteral(this);
	}

	@Override
	public String toString() {
		return text;
	}
}
