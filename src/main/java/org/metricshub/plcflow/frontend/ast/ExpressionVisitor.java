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
 * Visitor over the {@link Expression} node kinds.
 *
 * @param <R> result type
 */
public interface ExpressionVisitor<R> {

	R visitLiteral(LiteralExpression expression);

	R visitIdentifier(IdentifierExpression expression);

	R visitDirectAddress(DirectAddressExpression expression);

	R visitMemberAccess(MemberAccessExpression expression);

	R visitIndex(IndexExpression expression);

	R visitUnary(UnaryExpression expression);

	R visitBinary(BinaryExpression expression);

	R visitCall(CallExpression expression);

	R visitParenthesized(ParenthesizedExpression expression);
}
