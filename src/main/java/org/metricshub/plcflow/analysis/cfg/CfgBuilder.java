package org.metricshub.plcflow.analysis.cfg;

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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.metricshub.plcflow.SourceSpan;
import org.metricshub.plcflow.analysis.DecisionCounter;
import org.metricshub.plcflow.frontend.ast.AssignmentStatement;
import org.metricshub.plcflow.frontend.ast.CaseArm;
import org.metricshub.plcflow.frontend.ast.CaseLabel;
import org.metricshub.plcflow.frontend.ast.CaseStatement;
import org.metricshub.plcflow.frontend.ast.ConditionalBlock;
import org.metricshub.plcflow.frontend.ast.ContinueStatement;
import org.metricshub.plcflow.frontend.ast.EmptyStatement;
import org.metricshub.plcflow.frontend.ast.ExitStatement;
import org.metricshub.plcflow.frontend.ast.Expression;
import org.metricshub.plcflow.frontend.ast.ForStatement;
import org.metricshub.plcflow.frontend.ast.GotoStatement;
import org.metricshub.plcflow.frontend.ast.IfStatement;
import org.metricshub.plcflow.frontend.ast.InvocationStatement;
import org.metricshub.plcflow.frontend.ast.LabelStatement;
import org.metricshub.plcflow.frontend.ast.Pou;
import org.metricshub.plcflow.frontend.ast.PragmaStatement;
import org.metricshub.plcflow.frontend.ast.RepeatStatement;
import org.metricshub.plcflow.frontend.ast.ReturnStatement;
import org.metricshub.plcflow.frontend.ast.Statement;
import org.metricshub.plcflow.frontend.ast.StatementVisitor;
import org.metricshub.plcflow.frontend.ast.WhileStatement;
import org.metricshub.plcflow.util.PlcLogger;
import org.slf4j.Logger;

/**
 * Builds the {@link ControlFlowGraph} of a statement list.
 * <p>
 * Consecutive assignments, invocations, empty statements, labels and GOTOs
 * are folded into a single {@link NodeKind#BASIC} node; a label always
 * starts a new node and a GOTO always ends one. GOTO does not jump: it
 * falls through to the next statement and its target is only checked,
 * unknown targets being listed by {@link ControlFlowGraph#getUnresolvedLabels()}.
 * <p>
 * IF and ELSIF conditions become a chain of {@link NodeKind#BRANCH} nodes
 * linked by their FALSE_BRANCH edges. CASE arms are modeled the same way:
 * one binary branch per arm, the last FALSE_BRANCH leading to the ELSE
 * statements or to the code after the CASE.
 * <p>
 * A FOR or WHILE loop is a {@link NodeKind#LOOP_HEADER} whose TRUE_BRANCH
 * enters the body, a latch node that collects the ends of the body and
 * loops back to the header, and a {@link NodeKind#LOOP_EXIT} node reached
 * from the header. A REPEAT runs its body first: a REPEAT node leads to the
 * body, whose ends reach the UNTIL header, which loops back to the REPEAT
 * node or leaves through its LOOP_EXIT edge.
 * <p>
 * RETURN and EXIT lead straight to the exit node, with a RETURN edge.
 * CONTINUE leads to the latch of the enclosing loop (the UNTIL header of a
 * REPEAT), or to the exit node
 * when there is none. Nothing is linked to the statements that follow them
 * in the same block, which are therefore unreachable.
 * <p>
 * Node ids follow the order of the statements, so that the same statement
 * list always produces the same graph. This class holds no state and may be
 * shared between threads.
 */
public class CfgBuilder {

	private static final Logger LOG = PlcLogger.getLogger(CfgBuilder.class);

	private static final String EMPTY_LABEL = "<empty>";

	/**
	 * Builds the graph of the body of a POU.
	 *
	 * @param pou the program organization unit
	 * @return the graph of its body
	 */
	public ControlFlowGraph build(Pou pou) {
		ControlFlowGraph graph = build(pou.getBody());
		LOG.debug("Built {} for {}", graph, pou.getName());
		return graph;
	}

	/**
	 * Builds the graph of a statement list.
	 *
	 * @param statements the statements, in execution order
	 * @return the graph
	 * @throws IllegalStateException if the resulting graph is malformed
	 */
	public ControlFlowGraph build(List<Statement> statements) {
		if (statements == null) {
			throw new IllegalArgumentException("No statements supplied");
		}
		return new Construction().run(statements);
	}

	/**
	 * Node under construction
	 */
	private static final class Block {
		private final int id;
		private final NodeKind kind;
		private final List<String> labels = new ArrayList<String>();
		private SourceSpan span;
		private int statementCount;
		private final int shortCircuitCount;

		private Block(int id, NodeKind kind, String label, SourceSpan span, int shortCircuitCount) {
			this.id = id;
			this.kind = kind;
			this.labels.add(label);
			this.span = span == null ? SourceSpan.NONE : span;
			this.shortCircuitCount = shortCircuitCount;
		}

		private void append(Statement statement) {
			if (statementCount == 0 && kind == NodeKind.BASIC) {
				labels.clear();
			}
			labels.add(statement.toString());
			span = span.to(statement.getSpan());
			statementCount++;
		}

		private CfgNode toNode() {
			StringBuilder label = new StringBuilder();
			for (String part : labels) {
				if (label.length() > 0) {
					label.append("; ");
				}
				label.append(part);
			}
			return new CfgNode(id, kind, label.toString(), span, statementCount, shortCircuitCount);
		}
	}

	/**
	 * Edge whose source is known and whose target is the next node created
	 */
	private static final class PendingEdge {
		private final int source;
		private final EdgeKind kind;

		private PendingEdge(int source, EdgeKind kind) {
			this.source = source;
			this.kind = kind;
		}
	}

	/**
	 * Edges that go to the latch of a loop being built
	 */
	private static final class LoopContext {
		private final List<PendingEdge> continueEdges = new ArrayList<PendingEdge>();
	}

	/**
	 * State of one {@link CfgBuilder#build(List)} call.
	 */
	private static final class Construction implements StatementVisitor<Void> {

		private final List<Block> blocks = new ArrayList<Block>();
		private final List<CfgEdge> edges = new ArrayList<CfgEdge>();
		private List<PendingEdge> openEdges = new ArrayList<PendingEdge>();
		private final List<PendingEdge> returnEdges = new ArrayList<PendingEdge>();
		private final Deque<LoopContext> loops = new ArrayDeque<LoopContext>();
		private final Set<String> labels = new HashSet<String>();
		private final List<String> gotoTargets = new ArrayList<String>();

		/** BASIC node that the next straight-line statement joins, if any */
		private Block current;

		private ControlFlowGraph run(List<Statement> statements) {
			Block entry = newBlock(NodeKind.ENTRY, "ENTRY", SourceSpan.NONE, 0);
			openEdges.add(new PendingEdge(entry.id, EdgeKind.SEQUENTIAL));

			for (Statement statement : statements) {
				statement.accept(this);
			}

			openEdges.addAll(returnEdges);
			newBlock(NodeKind.EXIT, "EXIT", SourceSpan.NONE, 0);

			List<CfgNode> nodes = new ArrayList<CfgNode>(blocks.size());
			for (Block block : blocks) {
				nodes.add(block.toNode());
			}
			// label names are case-insensitive: report each missing one once
			Set<String> reported = new HashSet<String>();
			List<String> unresolved = new ArrayList<String>();
			for (String target : gotoTargets) {
				String key = target.toUpperCase(Locale.ROOT);
				if (!labels.contains(key) && reported.add(key)) {
					unresolved.add(target);
				}
			}
			return new ControlFlowGraph(nodes, edges, unresolved);
		}

		/**
		 * Creates a node and connects all open edges to it.
		 */
		private Block newBlock(NodeKind kind, String label, SourceSpan span, int shortCircuitCount) {
			Block block = new Block(blocks.size(), kind, label, span, shortCircuitCount);
			blocks.add(block);
			for (PendingEdge pending : openEdges) {
				edges.add(new CfgEdge(pending.source, block.id, pending.kind));
			}
			openEdges = new ArrayList<PendingEdge>();
			return block;
		}

		private void openFrom(Block block, EdgeKind kind) {
			openEdges.add(new PendingEdge(block.id, kind));
		}

		/**
		 * Adds a straight-line statement to the current BASIC node, opening a
		 * new one if needed.
		 */
		private Block straight(Statement statement) {
			if (current == null) {
				current = newBlock(NodeKind.BASIC, EMPTY_LABEL, statement.getSpan(), 0);
				openFrom(current, EdgeKind.SEQUENTIAL);
			}
			current.append(statement);
			return current;
		}

		/**
		 * Ends the current node with a transfer that does not fall through.
		 */
		private void terminal(Statement statement, List<PendingEdge> destination, EdgeKind kind) {
			Block block = straight(statement);
			openEdges = new ArrayList<PendingEdge>();
			destination.add(new PendingEdge(block.id, kind));
			current = null;
		}

		/**
		 * Builds a nested statement list; an empty list gets its own empty node.
		 */
		private void body(List<Statement> statements) {
			current = null;
			boolean empty = true;
			for (Statement statement : statements) {
				if (!(statement instanceof PragmaStatement)) {
					empty = false;
				}
			}
			if (empty) {
				Block block = newBlock(NodeKind.BASIC, EMPTY_LABEL, SourceSpan.NONE, 0);
				openFrom(block, EdgeKind.SEQUENTIAL);
			} else {
				for (Statement statement : statements) {
					statement.accept(this);
				}
			}
			current = null;
		}

		private void loop(
				String header,
				Statement statement,
				Expression condition,
				List<Statement> body,
				String latch,
				String exit) {
			current = null;
			Block headerBlock = newBlock(
					NodeKind.LOOP_HEADER,
					header,
					statement.getSpan(),
					DecisionCounter.count(condition));

			openFrom(headerBlock, EdgeKind.TRUE_BRANCH);
			LoopContext context = new LoopContext();
			loops.push(context);
			try {
				body(body);
			} finally {
				loops.pop();
			}
			openEdges.addAll(context.continueEdges);

			Block latchBlock = newBlock(NodeKind.BASIC, latch, SourceSpan.NONE, 0);
			edges.add(new CfgEdge(latchBlock.id, headerBlock.id, EdgeKind.LOOP_BACK));

			openFrom(headerBlock, EdgeKind.LOOP_EXIT);
			Block exitBlock = newBlock(NodeKind.LOOP_EXIT, exit, SourceSpan.NONE, 0);
			openFrom(exitBlock, EdgeKind.SEQUENTIAL);
			current = null;
		}

		@Override
		public Void visitAssignment(AssignmentStatement statement) {
			straight(statement);
			return null;
		}

		@Override
		public Void visitInvocation(InvocationStatement statement) {
			straight(statement);
			return null;
		}

		@Override
		public Void visitEmpty(EmptyStatement statement) {
			straight(statement);
			return null;
		}

		@Override
		public Void visitPragma(PragmaStatement statement) {
			return null;
		}

		@Override
		public Void visitLabel(LabelStatement statement) {
			current = null;
			straight(statement);
			labels.add(statement.getName().toUpperCase(Locale.ROOT));
			return null;
		}

		@Override
		public Void visitGoto(GotoStatement statement) {
			straight(statement);
			gotoTargets.add(statement.getLabel());
			current = null;
			return null;
		}

		@Override
		public Void visitReturn(ReturnStatement statement) {
			terminal(statement, returnEdges, EdgeKind.RETURN);
			return null;
		}

		@Override
		public Void visitExit(ExitStatement statement) {
			terminal(statement, returnEdges, EdgeKind.RETURN);
			return null;
		}

		@Override
		public Void visitContinue(ContinueStatement statement) {
			if (loops.isEmpty()) {
				terminal(statement, returnEdges, EdgeKind.RETURN);
			} else {
				terminal(statement, loops.peek().continueEdges, EdgeKind.SEQUENTIAL);
			}
			return null;
		}

		@Override
		public Void visitIf(IfStatement statement) {
			current = null;
			List<PendingEdge> after = new ArrayList<PendingEdge>();
			boolean first = true;
			for (ConditionalBlock branch : statement.getBranches()) {
				Block decision = newBlock(
						NodeKind.BRANCH,
						(first ? "IF " : "ELSIF ") + branch.getCondition(),
						branch.getSpan(),
						DecisionCounter.count(branch.getCondition()));
				first = false;
				openFrom(decision, EdgeKind.TRUE_BRANCH);
				body(branch.getBody());
				after.addAll(openEdges);
				openEdges = new ArrayList<PendingEdge>();
				openFrom(decision, EdgeKind.FALSE_BRANCH);
			}
			if (statement.hasElse()) {
				body(statement.getElseBody());
			}
			after.addAll(openEdges);
			openEdges = after;
			current = null;
			return null;
		}

		@Override
		public Void visitCase(CaseStatement statement) {
			current = null;
			List<PendingEdge> after = new ArrayList<PendingEdge>();
			for (CaseArm arm : statement.getArms()) {
				StringBuilder label = new StringBuilder("CASE ").append(statement.getSelector()).append(" = ");
				for (int i = 0; i < arm.getLabels().size(); i++) {
					CaseLabel value = arm.getLabels().get(i);
					label.append(i == 0 ? "" : ", ").append(value);
				}
				Block decision = newBlock(NodeKind.BRANCH, label.toString(), arm.getSpan(), 0);
				openFrom(decision, EdgeKind.TRUE_BRANCH);
				body(arm.getBody());
				after.addAll(openEdges);
				openEdges = new ArrayList<PendingEdge>();
				openFrom(decision, EdgeKind.FALSE_BRANCH);
			}
			if (statement.hasElse()) {
				body(statement.getElseBody());
			}
			after.addAll(openEdges);
			openEdges = after;
			current = null;
			return null;
		}

		@Override
		public Void visitFor(ForStatement statement) {
			loop(
					statement.toString(),
					statement,
					null,
					statement.getBody(),
					"NEXT " + statement.getVariable(),
					"END_FOR");
			return null;
		}

		@Override
		public Void visitWhile(WhileStatement statement) {
			loop(
					statement.toString(),
					statement,
					statement.getCondition(),
					statement.getBody(),
					"LOOP",
					"END_WHILE");
			return null;
		}

		@Override
		public Void visitRepeat(RepeatStatement statement) {
			current = null;
			Block start = newBlock(NodeKind.BASIC, "REPEAT", statement.getSpan(), 0);
			openFrom(start, EdgeKind.SEQUENTIAL);
			LoopContext context = new LoopContext();
			loops.push(context);
			try {
				body(statement.getBody());
			} finally {
				loops.pop();
			}
			openEdges.addAll(context.continueEdges);

			Block until = newBlock(
					NodeKind.LOOP_HEADER,
					"UNTIL " + statement.getCondition(),
					statement.getCondition().getSpan(),
					DecisionCounter.count(statement.getCondition()));
			edges.add(new CfgEdge(until.id, start.id, EdgeKind.LOOP_BACK));

			openFrom(until, EdgeKind.LOOP_EXIT);
			Block exitBlock = newBlock(NodeKind.LOOP_EXIT, "END_REPEAT", SourceSpan.NONE, 0);
			openFrom(exitBlock, EdgeKind.SEQUENTIAL);
			current = null;
			return null;
		}
	}
}
