package org.metricshub.plcflow;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.plcflow.analysis.ControlFlowMetrics;
import org.metricshub.plcflow.analysis.cfg.ControlFlowGraph;
import org.metricshub.plcflow.analysis.symbols.SymbolFinding;
import org.metricshub.plcflow.frontend.ast.Pou;

/**
 * A POU together with its control-flow graph, its metrics and the name
 * resolution problems found in it.
 */
public final class PouAnalysis {

	private final Pou pou;
	private final ControlFlowGraph graph;
	private final ControlFlowMetrics metrics;
	private final List<SymbolFinding> symbolFindings;

	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "The syntax tree and the graph are immutable and shared as is.")
	public PouAnalysis(Pou pou, ControlFlowGraph graph, ControlFlowMetrics metrics, List<SymbolFinding> symbolFindings) {
		this.pou = pou;
		this.graph = graph;
		this.metrics = metrics;
		this.symbolFindings = Collections.unmodifiableList(new ArrayList<SymbolFinding>(symbolFindings));
	}

	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The syntax tree is immutable.")
	public Pou getPou() {
		return pou;
	}

	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The graph is immutable.")
	public ControlFlowGraph getGraph() {
		return graph;
	}

	public ControlFlowMetrics getMetrics() {
		return metrics;
	}

	/**
	 * @return undefined, duplicate, unused or constant-assigned names, ordered by position
	 */
	public List<SymbolFinding> getSymbolFindings() {
		return symbolFindings;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return pou.getKind() + " " + pou.getName() + ": " + metrics;
	}
}
