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

import org.metricshub.plcflow.SourceSpan;

/**
 * A node of a {@link ControlFlowGraph}.
 * <p>
 * A {@link NodeKind#BASIC} node stands for a run of consecutive
 * straight-line statements; {@link #getStatementCount()} tells how many.
 * Decision nodes ({@link NodeKind#BRANCH} and {@link NodeKind#LOOP_HEADER})
 * carry the number of short-circuit operators (<code>AND</code>,
 * <code>OR</code>) of their condition.
 */
public final class CfgNode {

	private final int id;
	private final NodeKind kind;
	private final String label;
	private final SourceSpan span;
	private final int statementCount;
	private final int shortCircuitCount;

	/**
	 * @param id position of the node in its graph
	 * @param kind role of the node
	 * @param label human readable summary of the node
	 * @param span source covered by the node, {@link SourceSpan#NONE} for
	 *        synthetic nodes
	 * @param statementCount number of statements folded into the node
	 * @param shortCircuitCount number of AND/OR operators in the node's
	 *        condition
	 */
	public CfgNode(int id, NodeKind kind, String label, SourceSpan span, int statementCount, int shortCircuitCount) {
		this.id = id;
		this.kind = kind;
		this.label = label;
		this.span = span == null ? SourceSpan.NONE : span;
		this.statementCount = statementCount;
		this.shortCircuitCount = shortCircuitCount;
	}

	public int getId() {
		return id;
	}

	public NodeKind getKind() {
		return kind;
	}

	public String getLabel() {
		return label;
	}

	/**
	 * @return the source covered by the node, {@link SourceSpan#NONE} for
	 *         entry, exit and other synthetic nodes
	 */
	public SourceSpan getSpan() {
		return span;
	}

	public int getStatementCount() {
		return statementCount;
	}

	public int getShortCircuitCount() {
		return shortCircuitCount;
	}

	/**
	 * @return whether the node is a decision point (a branch or a loop header)
	 */
	public boolean isDecision() {
		return kind == NodeKind.BRANCH || kind == NodeKind.LOOP_HEADER;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return id + ":" + kind + "[" + label + "]";
	}
}
