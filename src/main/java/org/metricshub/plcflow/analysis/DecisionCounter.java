package org.metricshub.plcflow.analysis;

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

import org.metricshub.plcflow.frontend.ast.Argument;
import org.metricshub.plcflow.frontend.ast.BinaryExpression;
import org.metricshub.plcflow.frontend.ast.CallExpression;
import org.metricshub.plcflow.frontend.ast.DirectAddressExpression;
import org.metricshub.plcflow.frontend.ast.Expression;
import org.metricshub.plcflow.frontend.ast.ExpressionVisitor;
import org.metricshub.plcflow.frontend.ast.IdentifierExpression;
import org.metricshub.plcflow.frontend.ast.IndexExpression;
import org.metricshub.plcflow.frontend.ast.LiteralExpression;
import org.metricshub.plcflow.frontend.ast.MemberAccessExpression;
import org.metricshub.plcflow.frontend.ast.ParenthesizedExpression;
import org.metricshub.plcflow.frontend.ast.UnaryExpression;

/**
 * Counts the short-circuit operators (<code>AND</code>, <code>&amp;</code>,
 * <code>OR</code>) of an expression. Each one is an extra decision for the
 * condition complexity. <code>XOR</code> evaluates both operands and is not
 * counted.
 */
public final class DecisionCounter implements ExpressionVisitor<Integer> {

	private static final DecisionCounter INSTANCE = new DecisionCounter();

	private DecisionCounter() {}

	/**
	 * @param expression a condition, may be {@code null}
	 * @return the number of AND/OR operators in {@code expression}, anywhere
	 *         in the tree (call arguments and indices included)
	 */
	public static int count(Expression expression) {
		return expression == null ? 0 : expression.accept(INSTANCE).intValue();
	}

	@Override
	public Integer visitLiteral(LiteralExpression expression) {
		return 0;
	}

	@Override
	public Integer visitIdentifier(IdentifierExpression expression) {
		return 0;
	}

	@Override
	public Integer visitDirectAddress(DirectAddressExpression expression) {
		return 0;
	}

	@Override
	public Integer visitMemberAccess(MemberAccessExpression expression) {
		return count(expression.getTarget());
	}

	@Override
	public Integer visitIndex(IndexExpression expression) {
		int total = count(expression.getTarget());
		for (Expression index : expression.getIndices()) {
			total += count(index);
		}
		return total;
	}

	@Override
	public Integer visitUnary(UnaryExpression expression) {
		return count(expression.getOperand());
	}

	@Override
	public Integer visitBinary(BinaryExpression expression) {
		int own = expression.getOperator().isShortCircuit() ? 1 : 0;
		return own + count(expression.getLeft()) + count(expression.getRight());
	}

	@Override
	public Integer visitCall(CallExpression expression) {
		int total = count(expression.getCallee());
		for (Argument argument : expression.getArguments()) {
			total += count(argument.getValue());
		}
		return total;
	}

	@Override
	public Integer visitParenthesized(ParenthesizedExpression expression) {
		return count(expression.getInner());
	}
}
