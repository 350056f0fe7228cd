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
import org.metricshub.plcflow.analysis.cfg.CfgBuilder;
import org.metricshub.plcflow.analysis.cfg.CfgEdge;
import org.metricshub.plcflow.analysis.cfg.CfgNode;
import org.metricshub.plcflow.analysis.cfg.ControlFlowGraph;
import org.metricshub.plcflow.frontend.ast.Pou;
import org.metricshub.plcflow.frontend.ast.Statement;
import org.metricshub.plcflow.util.PlcLogger;
import org.slf4j.Logger;

/**
 * Computes {@link ControlFlowMetrics} from a control-flow graph and the
 * statements it was built from.
 * <p>
 * Only the part of the graph reachable from the entry node contributes to
 * the complexity figures: unreachable nodes and the edges that leave them
 * are ignored. The nesting depth is computed from the statements, not from
 * the graph.
 */
public class ComplexityAnalyzer {

	private static final Logger LOG = PlcLogger.getLogger(ComplexityAnalyzer.class);

	private final CfgBuilder builder;

	public ComplexityAnalyzer() {
		this(new CfgBuilder());
	}

	/**
	 * @param builder builds the graphs of {@link #analyze(Pou)} and
	 *        {@link #analyze(List)}
	 */
	public ComplexityAnalyzer(CfgBuilder builder) {
		this.builder = builder;
	}

	/**
	 * @param pou a parsed POU
	 * @return the metrics of its body
	 */
	public ControlFlowMetrics analyze(Pou pou) {
		return analyze(builder.build(pou), pou.getBody());
	}

	/**
	 * @param statements a statement list
	 * @return its metrics
	 */
	public ControlFlowMetrics analyze(List<Statement> statements) {
		return analyze(builder.build(statements), statements);
	}

	/**
	 * @param graph the graph built from {@code statements}
	 * @param statements the statements, for the nesting depth
	 * @return the metrics
	 */
	public ControlFlowMetrics analyze(ControlFlowGraph graph, List<Statement> statements) {
		List<CfgNode> reachable = graph.getReachableNodes();
		int decisions = 0;
		int shortCircuits = 0;
		for (CfgNode node : reachable) {
			if (node.isDecision()) {
				decisions++;
				shortCircuits += node.getShortCircuitCount();
			}
		}

		ControlFlowMetrics metrics = new ControlFlowMetrics(
				cyclomaticComplexity(graph),
				decisions + 1,
				decisions + 1 + shortCircuits,
				NestingDepthCalculator.maxDepth(statements),
				graph.getNodes().size() - reachable.size(),
				graph.getNodes().size(),
				graph.getEdges().size());
		if (metrics.getCyclomaticComplexity() != metrics.getDecisionComplexity()) {
			LOG.warn("Edge and decision complexities disagree: {}", metrics);
		} else {
			LOG.debug("Metrics: {}", metrics);
		}
		return metrics;
	}

	/**
	 * Edge formula E - N + 2, over the nodes reachable from the entry and
	 * the edges leaving them.
	 *
	 * @param graph a control-flow graph
	 * @return its cyclomatic complexity
	 */
	public static int cyclomaticComplexity(ControlFlowGraph graph) {
		List<CfgNode> reachable = graph.getReachableNodes();
		int edgeCount = 0;
		for (CfgNode node : reachable) {
			List<CfgEdge> outgoing = graph.getOutgoingEdges(node.getId());
			edgeCount += outgoing.size();
		}
		return edgeCount - reachable.size() + 2;
	}
}
