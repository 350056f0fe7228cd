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

import java.util.List;
import org.metricshub.plcflow.frontend.ast.AssignmentStatement;
import org.metricshub.plcflow.frontend.ast.CaseArm;
import org.metricshub.plcflow.frontend.ast.CaseStatement;
import org.metricshub.plcflow.frontend.ast.ConditionalBlock;
import org.metricshub.plcflow.frontend.ast.ContinueStatement;
import org.metricshub.plcflow.frontend.ast.EmptyStatement;
import org.metricshub.plcflow.frontend.ast.ExitStatement;
import org.metricshub.plcflow.frontend.ast.ForStatement;
import org.metricshub.plcflow.frontend.ast.GotoStatement;
import org.metricshub.plcflow.frontend.ast.IfStatement;
import org.metricshub.plcflow.frontend.ast.InvocationStatement;
import org.metricshub.plcflow.frontend.ast.LabelStatement;
import org.metricshub.plcflow.frontend.ast.PragmaStatement;
import org.metricshub.plcflow.frontend.ast.RepeatStatement;
import org.metricshub.plcflow.frontend.ast.ReturnStatement;
import org.metricshub.plcflow.frontend.ast.Statement;
import org.metricshub.plcflow.frontend.ast.StatementVisitor;
import org.metricshub.plcflow.frontend.ast.WhileStatement;

/**
 * Computes the largest number of IF, CASE, FOR, WHILE and REPEAT statements
 * open at the same time in a statement tree. ELSIF and ELSE branches belong
 * to their IF and do not add a level.
 */
public final class NestingDepthCalculator implements StatementVisitor<Integer> {

	private static final NestingDepthCalculator INSTANCE = new NestingDepthCalculator();

	private NestingDepthCalculator() {}

	/**
	 * @param statements a statement list
	 * @return the maximum nesting depth, 0 for straight-line code
	 */
	public static int maxDepth(List<Statement> statements) {
		int max = 0;
		if (statements != null) {
			for (Statement statement : statements) {
				max = Math.max(max, statement.accept(INSTANCE).intValue());
			}
		}
		return max;
	}

	@Override
	public Integer visitIf(IfStatement statement) {
		int inner = maxDepth(statement.getElseBody());
		for (ConditionalBlock branch : statement.getBranches()) {
			inner = Math.max(inner, maxDepth(branch.getBody()));
		}
		return inner + 1;
	}

	@Override
	public Integer visitCase(CaseStatement statement) {
		int inner = maxDepth(statement.getElseBody());
		for (CaseArm arm : statement.getArms()) {
			inner = Math.max(inner, maxDepth(arm.getBody()));
		}
		return inner + 1;
	}

	@Override
	public Integer visitFor(ForStatement statement) {
		return maxDepth(statement.getBody()) + 1;
	}

	@Override
	public Integer visitWhile(WhileStatement statement) {
		return maxDepth(statement.getBody()) + 1;
	}

	@Override
	public Integer visitRepeat(RepeatStatement statement) {
		return maxDepth(statement.getBody()) + 1;
	}

	@Override
	public Integer visitAssignment(AssignmentStatement statement) {
		return 0;
	}

	@Override
	public Integer visitExit(ExitStatement statement) {
		return 0;
	}

	@Override
	public Integer visitContinue(ContinueStatement statement) {
		return 0;
	}

	@Override
	public Integer visitReturn(ReturnStatement statement) {
		return 0;
	}

	@Override
	public Integer visitGoto(GotoStatement statement) {
		return 0;
	}

	@Override
	public Integer visitLabel(LabelStatement statement) {
		return 0;
	}

	@Override
	public Integer visitInvocation(InvocationStatement statement) {
		return 0;
	}

	@Override
	public Integer visitEmpty(EmptyStatement statement) {
		return 0;
	}

	@Override
	public Integer visitPragma(PragmaStatement statement) {
		return 0;
	}
}
