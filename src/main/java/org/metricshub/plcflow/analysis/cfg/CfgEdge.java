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

/**
 * A directed edge between two nodes of a {@link ControlFlowGraph},
 * identified by their ids.
 */
public final class CfgEdge {

	private final int source;
	private final int target;
	private final EdgeKind kind;

	/**
	 * @param source id of the node the edge leaves
	 * @param target id of the node the edge enters
	 * @param kind the transfer the edge represents
	 */
	public CfgEdge(int source, int target, EdgeKind kind) {
		if (kind == null) {
			throw new IllegalArgumentException("Edge kind is required");
		}
		this.source = source;
		this.target = target;
		this.kind = kind;
	}

	public int getSource() {
		return source;
	}

	public int getTarget() {
		return target;
	}

	public EdgeKind getKind() {
		return kind;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof CfgEdge)) {
			return false;
		}
		CfgEdge other = (CfgEdge) obj;
		return source == other.source && target == other.target && kind == other.kind;
	}

	@Override
	public int hashCode() {
		return (31 * source + target) * 31 + kind.hashCode();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return source + " -" + kind + "-> " + target;
	}
}
