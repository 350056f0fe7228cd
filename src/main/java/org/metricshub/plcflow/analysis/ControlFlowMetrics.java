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

/**
 * Complexity and reachability figures of one statement list.
 */
public final class ControlFlowMetrics {

	private final int cyclomaticComplexity;
	private final int decisionComplexity;
	private final int conditionComplexity;
	private final int maxNestingDepth;
	private final int unreachableNodeCount;
	private final int nodeCount;
	private final int edgeCount;

	/**
	 * @param cyclomaticComplexity edges - nodes + 2, over the reachable part of the graph
	 * @param decisionComplexity reachable decision nodes + 1
	 * @param conditionComplexity decision complexity plus the AND/OR operators of the reachable decisions
	 * @param maxNestingDepth largest number of nested control statements
	 * @param unreachableNodeCount number of nodes without a path from the entry
	 * @param nodeCount number of nodes in the graph
	 * @param edgeCount number of edges in the graph
	 */
	public ControlFlowMetrics(
			int cyclomaticComplexity,
			int decisionComplexity,
			int conditionComplexity,
			int maxNestingDepth,
			int unreachableNodeCount,
			int nodeCount,
			int edgeCount) {
		this.cyclomaticComplexity = cyclomaticComplexity;
		this.decisionComplexity = decisionComplexity;
		this.conditionComplexity = conditionComplexity;
		this.maxNestingDepth = maxNestingDepth;
		this.unreachableNodeCount = unreachableNodeCount;
		this.nodeCount = nodeCount;
		this.edgeCount = edgeCount;
	}

	public int getCyclomaticComplexity() {
		return cyclomaticComplexity;
	}

	public int getDecisionComplexity() {
		return decisionComplexity;
	}

	public int getConditionComplexity() {
		return conditionComplexity;
	}

	public int getMaxNestingDepth() {
		return maxNestingDepth;
	}

	public int getUnreachableNodeCount() {
		return unreachableNodeCount;
	}

	public int getNodeCount() {
		return nodeCount;
	}

	public int getEdgeCount() {
		return edgeCount;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof ControlFlowMetrics)) {
			return false;
		}
		ControlFlowMetrics other = (ControlFlowMetrics) obj;
		return cyclomaticComplexity == other.cyclomaticComplexity
				&& decisionComplexity == other.decisionComplexity
				&& conditionComplexity == other.conditionComplexity
				&& maxNestingDepth == other.maxNestingDepth
				&& unreachableNodeCount == other.unreachableNodeCount
				&& nodeCount == other.nodeCount
				&& edgeCount == other.edgeCount;
	}

	@Override
	public int hashCode() {
		int hash = cyclomaticComplexity;
		hash = 31 * hash + decisionComplexity;
		hash = 31 * hash + conditionComplexity;
		hash = 31 * hash + maxNestingDepth;
		hash = 31 * hash + unreachableNodeCount;
		hash = 31 * hash + nodeCount;
		return 31 * hash + edgeCount;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return "cyclomatic=" + cyclomaticComplexity
				+ ", decision=" + decisionComplexity
				+ ", condition=" + conditionComplexity
				+ ", nesting=" + maxNestingDepth
				+ ", unreachable=" + unreachableNodeCount
				+ ", nodes=" + nodeCount
				+ ", edges=" + edgeCount;
	}
}
