package org.metricshub.plcflow.analysis.symbols;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.plcflow.SourceSpan;
import org.metricshub.plcflow.frontend.ast.Argument;
import org.metricshub.plcflow.frontend.ast.AssignmentStatement;
import org.metricshub.plcflow.frontend.ast.BinaryExpression;
import org.metricshub.plcflow.frontend.ast.CallExpression;
import org.metricshub.plcflow.frontend.ast.CaseArm;
import org.metricshub.plcflow.frontend.ast.CaseLabel;
import org.metricshub.plcflow.frontend.ast.CaseStatement;
import org.metricshub.plcflow.frontend.ast.ConditionalBlock;
import org.metricshub.plcflow.frontend.ast.ContinueStatement;
import org.metricshub.plcflow.frontend.ast.DirectAddressExpression;
import org.metricshub.plcflow.frontend.ast.EmptyStatement;
import org.metricshub.plcflow.frontend.ast.EnumValue;
import org.metricshub.plcflow.frontend.ast.ExitStatement;
import org.metricshub.plcflow.frontend.ast.Expression;
import org.metricshub.plcflow.frontend.ast.ExpressionVisitor;
import org.metricshub.plcflow.frontend.ast.ForStatement;
import org.metricshub.plcflow.frontend.ast.GotoStatement;
import org.metricshub.plcflow.frontend.ast.IdentifierExpression;
import org.metricshub.plcflow.frontend.ast.IfStatement;
import org.metricshub.plcflow.frontend.ast.IndexExpression;
import org.metricshub.plcflow.frontend.ast.InvocationStatement;
import org.metricshub.plcflow.frontend.ast.LabelStatement;
import org.metricshub.plcflow.frontend.ast.LiteralExpression;
import org.metricshub.plcflow.frontend.ast.MemberAccessExpression;
import org.metricshub.plcflow.frontend.ast.ParenthesizedExpression;
import org.metricshub.plcflow.frontend.ast.Pou;
import org.metricshub.plcflow.frontend.ast.PouKind;
import org.metricshub.plcflow.frontend.ast.PragmaStatement;
import org.metricshub.plcflow.frontend.ast.RepeatStatement;
import org.metricshub.plcflow.frontend.ast.ReturnStatement;
import org.metricshub.plcflow.frontend.ast.Statement;
import org.metricshub.plcflow.frontend.ast.StatementVisitor;
import org.metricshub.plcflow.frontend.ast.Subrange;
import org.metricshub.plcflow.frontend.ast.TypeDeclaration;
import org.metricshub.plcflow.frontend.ast.TypeReference;
import org.metricshub.plcflow.frontend.ast.UnaryExpression;
import org.metricshub.plcflow.frontend.ast.VariableBlock;
import org.metricshub.plcflow.frontend.ast.VariableDeclaration;
import org.metricshub.plcflow.frontend.ast.WhileStatement;
import org.metricshub.plcflow.util.PlcLogger;
import org.slf4j.Logger;

/**
 * Resolves the names used in a POU against its declarations.
 * <p>
 * The POU scope holds the declared variables and, for a FUNCTION, its own
 * name. Its parent scope holds the values of the enumerated types declared
 * in the same source. Names are compared ignoring case.
 * <p>
 * The following are not resolved: the callee of a call (standard functions
 * and other POUs are not declared), the member of a {@code target.member}
 * access, named argument names, qualified enumerated values
 * ({@code Color#Red}), direct addresses, labels and type names.
 * <p>
 * A POU without any variable block is not resolved: a body parsed on its
 * own declares nothing and takes all its names from elsewhere.
 * <p>
 * Instances hold no state and may be shared between threads.
 */
public class SymbolAnalyzer {

	private static final Logger LOG = PlcLogger.getLogger(SymbolAnalyzer.class);

	/**
	 * @param pou a parsed POU
	 * @return its findings, ordered by position
	 */
	public List<SymbolFinding> analyze(Pou pou) {
		return analyze(pou, Collections.<TypeDeclaration>emptyList());
	}

	/**
	 * @param pou a parsed POU
	 * @param types the type declarations of the source the POU comes from
	 * @return its findings, ordered by position
	 */
	public List<SymbolFinding> analyze(Pou pou, List<TypeDeclaration> types) {
		if (pou.getVariableBlocks().isEmpty()) {
			LOG.debug("{} declares nothing, its names are not resolved", pou.getName());
			return Collections.emptyList();
		}
		Resolver resolver = new Resolver(scope(pou, types));
		resolver.declarations(pou);
		resolver.statements(pou.getBody());

		List<SymbolFinding> findings = resolver.findings;
		for (Symbol unused : resolver.table.getUnreferenced()) {
			findings.add(new SymbolFinding(SymbolFinding.Kind.UNUSED_VARIABLE, unused.getName(), unused.getSpan()));
		}
		Collections.sort(findings);
		LOG.debug("{}: {} symbols, {} findings", pou.getName(), resolver.table.getSymbols().size(), findings.size());
		return Collections.unmodifiableList(findings);
	}

	/**
	 * @return an empty POU scope whose parent holds the enumerated values of {@code types}
	 */
	private static SymbolTable scope(Pou pou, List<TypeDeclaration> types) {
		SymbolTable global = new SymbolTable("global");
		for (TypeDeclaration type : types) {
			for (EnumValue value : type.getEnumValues()) {
				global.define(new Symbol(value.getName(), SymbolKind.ENUM_VALUE, null, true, value.getSpan()));
			}
		}
		return new SymbolTable(pou.getName(), global);
	}

	/**
	 * One resolution pass: fills the POU scope, then walks the body.
	 */
	private static final class Resolver implements StatementVisitor<Void>, ExpressionVisitor<Void> {

		private final SymbolTable table;
		private final List<SymbolFinding> findings = new ArrayList<SymbolFinding>();

		private Resolver(SymbolTable table) {
			this.table = table;
		}

		private void declarations(Pou pou) {
			for (VariableBlock block : pou.getVariableBlocks()) {
				for (VariableDeclaration declaration : block.getDeclarations()) {
					for (String name : declaration.getNames()) {
						Symbol symbol = new Symbol(
								name,
								SymbolKind.VARIABLE,
								declaration.getVariableClass(),
								declaration.isConstant(),
								declaration.getSpan());
						if (table.define(symbol) != null) {
							findings.add(new SymbolFinding(SymbolFinding.Kind.DUPLICATE_DEFINITION, name, declaration.getSpan()));
						}
					}
				}
			}
			if (pou.getKind() == PouKind.FUNCTION && !table.isDefinedLocally(pou.getName())) {
				table.define(new Symbol(pou.getName(), SymbolKind.FUNCTION_RESULT, null, false, pou.getSpan()));
			}

			// initial values and bounds may refer to any declared constant
			for (VariableDeclaration declaration : pou.getDeclarations()) {
				type(declaration.getType());
				expression(declaration.getInitialValue());
			}
		}

		private void type(TypeReference type) {
			if (type == null) {
				return;
			}
			for (Subrange dimension : type.getDimensions()) {
				expression(dimension.getLow());
				expression(dimension.getHigh());
			}
			type(type.getElementType());
			expression(type.getLength());
			if (type.getRange() != null) {
				expression(type.getRange().getLow());
				expression(type.getRange().getHigh());
			}
		}

		private void statements(List<Statement> statements) {
			if (statements != null) {
				for (Statement statement : statements) {
					statement.accept(this);
				}
			}
		}

		private void expression(Expression expression) {
			if (expression != null) {
				expression.accept(this);
			}
		}

		private Symbol reference(String name, SourceSpan span) {
			Symbol symbol = table.reference(name);
			if (symbol == null) {
				findings.add(new SymbolFinding(SymbolFinding.Kind.UNDEFINED_IDENTIFIER, name, span));
			}
			return symbol;
		}

		private void write(String name, SourceSpan span) {
			Symbol symbol = reference(name, span);
			if (symbol != null && symbol.isConstant()) {
				findings.add(new SymbolFinding(SymbolFinding.Kind.ASSIGNMENT_TO_CONSTANT, name, span));
			}
		}

		@Override
		public Void visitAssignment(AssignmentStatement statement) {
			Expression target = statement.getTarget();
			if (target instanceof IdentifierExpression) {
				write(((IdentifierExpression) target).getName(), target.getSpan());
			} else {
				expression(target);
			}
			expression(statement.getValue());
			return null;
		}

		@Override
		public Void visitIf(IfStatement statement) {
			for (ConditionalBlock branch : statement.getBranches()) {
				expression(branch.getCondition());
				statements(branch.getBody());
			}
			statements(statement.getElseBody());
			return null;
		}

		@Override
		public Void visitCase(CaseStatement statement) {
			expression(statement.getSelector());
			for (CaseArm arm : statement.getArms()) {
				for (CaseLabel label : arm.getLabels()) {
					expression(label.getLow());
					expression(label.getHigh());
				}
				statements(arm.getBody());
			}
			statements(statement.getElseBody());
			return null;
		}

		@Override
		public Void visitFor(ForStatement statement) {
			write(statement.getVariable(), statement.getSpan());
			expression(statement.getStart());
			expression(statement.getEnd());
			expression(statement.getStep());
			statements(statement.getBody());
			return null;
		}

		@Override
		public Void visitWhile(WhileStatement statement) {
			expression(statement.getCondition());
			statements(statement.getBody());
			return null;
		}

		@Override
		public Void visitRepeat(RepeatStatement statement) {
			statements(statement.getBody());
			expression(statement.getCondition());
			return null;
		}

		@Override
		public Void visitExit(ExitStatement statement) {
			return null;
		}

		@Override
		public Void visitContinue(ContinueStatement statement) {
			return null;
		}

		@Override
		public Void visitReturn(ReturnStatement statement) {
			expression(statement.getValue());
			return null;
		}

		@Override
		public Void visitGoto(GotoStatement statement) {
			return null;
		}

		@Override
		public Void visitLabel(LabelStatement statement) {
			return null;
		}

		@Override
		public Void visitInvocation(InvocationStatement statement) {
			return statement.getCall().accept(this);
		}

		@Override
		public Void visitEmpty(EmptyStatement statement) {
			return null;
		}

		@Override
		public Void visitPragma(PragmaStatement statement) {
			return null;
		}

		@Override
		public Void visitLiteral(LiteralExpression expression) {
			return null;
		}

		@Override
		public Void visitIdentifier(IdentifierExpression expression) {
			String name = expression.getName();
			if (name.indexOf('#') < 0) {
				reference(name, expression.getSpan());
			}
			return null;
		}

		@Override
		public Void visitDirectAddress(DirectAddressExpression expression) {
			return null;
		}

		@Override
		public Void visitMemberAccess(MemberAccessExpression expression) {
			return expression.getTarget().accept(this);
		}

		@Override
		public Void visitIndex(IndexExpression expression) {
			expression.getTarget().accept(this);
			for (Expression index : expression.getIndices()) {
				index.accept(this);
			}
			return null;
		}

		@Override
		public Void visitUnary(UnaryExpression expression) {
			return expression.getOperand().accept(this);
		}

		@Override
		public Void visitBinary(BinaryExpression expression) {
			expression.getLeft().accept(this);
			return expression.getRight().accept(this);
		}

		@Override
		public Void visitCall(CallExpression expression) {
			Expression callee = expression.getCallee();
			if (callee instanceof IdentifierExpression) {
				// a function block instance is declared, a function is not
				table.reference(((IdentifierExpression) callee).getName());
			} else if (callee instanceof MemberAccessExpression) {
				((MemberAccessExpression) callee).getTarget().accept(this);
			} else {
				callee.accept(this);
			}
			for (Argument argument : expression.getArguments()) {
				expression(argument.getValue());
			}
			return null;
		}

		@Override
		public Void visitParenthesized(ParenthesizedExpression expression) {
			return expression.getInner().accept(this);
		}
	}
}
