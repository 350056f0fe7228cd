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
 * Visitor over the {@link Statement} node kinds.
 *
 * @param <R> result type
 */
public interface StatementVisitor<R> {

	R visitAssignment(AssignmentStatement statement);

	R visitIf(IfStatement statement);

	R visitCase(CaseStatement statement);

	R visitFor(ForStatement statement);

	R visitWhile(WhileStatement statement);

	R visitRepeat(RepeatStatement statement);

	R visitExit(ExitStatement statement);

	R visitContinue(ContinueStatement statement);

	R visitReturn(ReturnStatement statement);

	R visitGoto(GotoStatement statement);

	R visitLabel(LabelStatement statement);

	R visitInvocation(InvocationStatement statement);

	R visitEmpty(EmptyStatement statement);

	R visitPragma(PragmaStatement statement);
}
