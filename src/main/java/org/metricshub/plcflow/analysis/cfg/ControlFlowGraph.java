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
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable control-flow graph of one statement list.
 * <p>
 * Node ids are the positions of the nodes in {@link #getNodes()}; edges are
 * kept in creation order. The graph is checked on construction:
 * <ul>
 * <li>exactly one {@link NodeKind#ENTRY} node, without incoming edges;
 * <li>exactly one {@link NodeKind#EXIT} node, without outgoing edges;
 * <li>every {@link NodeKind#BRANCH} has one TRUE_BRANCH and one FALSE_BRANCH
 * outgoing edge;
 * <li>every {@link NodeKind#LOOP_HEADER} has one LOOP_EXIT outgoing edge
 * and exactly one LOOP_BACK edge. A header tested before the body (FOR,
 * WHILE) enters the body through a TRUE_BRANCH and receives the LOOP_BACK;
 * a header tested after the body (REPEAT) sends the LOOP_BACK itself;
 * <li>every other node has exactly one outgoing edge.
 * </ul>
 * A graph that breaks one of these rules is rejected with an
 * {@link IllegalStateException}.
 */
public final class ControlFlowGraph {

	private final List<CfgNode> nodes;
	private final List<CfgEdge> edges;
	private final List<String> unresolvedLabels;
	private final List<List<CfgEdge>> outgoing;
	private final List<List<CfgEdge>> incoming;
	private final CfgNode entry;
	private final CfgNode exit;

	/**
	 * Creates and checks a graph.
	 *
	 * @param nodes the nodes, the id of each being its position
	 * @param edges the edges between these nodes
	 * @param unresolvedLabels GOTO targets without a matching label
	 * @throws IllegalStateException if the graph is not well-formed
	 */
	public ControlFlowGraph(List<CfgNode> nodes, List<CfgEdge> edges, List<String> unresolvedLabels) {
		this.nodes = Collections.unmodifiableList(new ArrayList<CfgNode>(nodes));
		this.edges = Collections.unmodifiableList(new ArrayList<CfgEdge>(edges));
		this.unresolvedLabels = Collections.unmodifiableList(new ArrayList<String>(unresolvedLabels));

		List<List<CfgEdge>> out = new ArrayList<List<CfgEdge>>();
		List<List<CfgEdge>> in = new ArrayList<List<CfgEdge>>();
		CfgNode entryNode = null;
		CfgNode exitNode = null;
		for (int i = 0; i < this.nodes.size(); i++) {
			CfgNode node = this.nodes.get(i);
			if (node.getId() != i) {
				throw new IllegalStateException("Node " + node + " is at position " + i);
			}
			if (node.getKind() == NodeKind.ENTRY) {
				if (entryNode != null) {
					throw new IllegalStateException("Several entry nodes: " + entryNode + " and " + node);
				}
				entryNode = node;
			} else if (node.getKind() == NodeKind.EXIT) {
				if (exitNode != null) {
					throw new IllegalStateException("Several exit nodes: " + exitNode + " and " + node);
				}
				exitNode = node;
			}
			out.add(new ArrayList<CfgEdge>());
			in.add(new ArrayList<CfgEdge>());
		}
		if (entryNode == null || exitNode == null) {
			throw new IllegalStateException("A control-flow graph needs an entry and an exit node");
		}
		for (CfgEdge edge : this.edges) {
			if (edge.getSource() < 0 || edge.getSource() >= this.nodes.size()
					|| edge.getTarget() < 0 || edge.getTarget() >= this.nodes.size()) {
				throw new IllegalStateException("Edge " + edge + " refers to an unknown node");
			}
			out.get(edge.getSource()).add(edge);
			in.get(edge.getTarget()).add(edge);
		}
		for (int i = 0; i < out.size(); i++) {
			out.set(i, Collections.unmodifiableList(out.get(i)));
			in.set(i, Collections.unmodifiableList(in.get(i)));
		}
		this.outgoing = Collections.unmodifiableList(out);
		this.incoming = Collections.unmodifiableList(in);
		this.entry = entryNode;
		this.exit = exitNode;

		for (CfgNode node : this.nodes) {
			checkNode(node);
		}
	}

	private void checkNode(CfgNode node) {
		Map<EdgeKind, Integer> out = countByKind(outgoing.get(node.getId()));
		int outCount = outgoing.get(node.getId()).size();
		switch (node.getKind()) {
		case ENTRY:
			if (!incoming.get(node.getId()).isEmpty()) {
				throw new IllegalStateException("Entry node has incoming edges: " + incoming.get(node.getId()));
			}
			expectOutgoing(node, outCount == 1);
			break;
		case EXIT:
			expectOutgoing(node, outCount == 0);
			break;
		case BRANCH:
			expectOutgoing(node, outCount == 2 && count(out, EdgeKind.TRUE_BRANCH) == 1
					&& count(out, EdgeKind.FALSE_BRANCH) == 1);
			break;
		case LOOP_HEADER:
			boolean postTest = count(out, EdgeKind.LOOP_BACK) > 0;
			expectOutgoing(node, outCount == 2 && count(out, EdgeKind.LOOP_EXIT) == 1
					&& count(out, postTest ? EdgeKind.LOOP_BACK : EdgeKind.TRUE_BRANCH) == 1);
			int loopBacks = count(out, EdgeKind.LOOP_BACK)
					+ count(countByKind(incoming.get(node.getId())), EdgeKind.LOOP_BACK);
			if (loopBacks != 1) {
				throw new IllegalStateException("Loop header " + node + " needs exactly one LOOP_BACK edge");
			}
			break;
		default:
			expectOutgoing(node, outCount == 1);
			break;
		}
	}

	private void expectOutgoing(CfgNode node, boolean wellFormed) {
		if (!wellFormed) {
			throw new IllegalStateException("Malformed outgoing edges for " + node + ": " + outgoing.get(node.getId()));
		}
	}

	private static Map<EdgeKind, Integer> countByKind(List<CfgEdge> list) {
		Map<EdgeKind, Integer> counts = new EnumMap<EdgeKind, Integer>(EdgeKind.class);
		for (CfgEdge edge : list) {
			counts.put(edge.getKind(), count(counts, edge.getKind()) + 1);
		}
		return counts;
	}

	private static int count(Map<EdgeKind, Integer> counts, EdgeKind kind) {
		Integer count = counts.get(kind);
		return count == null ? 0 : count.intValue();
	}

	/**
	 * @return all nodes, ordered by id
	 */
	public List<CfgNode> getNodes() {
		return nodes;
	}

	/**
	 * @return all edges, in creation order
	 */
	public List<CfgEdge> getEdges() {
		return edges;
	}

	/**
	 * @param id a node id
	 * @return the node with this id
	 * @throws IndexOutOfBoundsException if there is no such node
	 */
	public CfgNode getNode(int id) {
		return nodes.get(id);
	}

	public CfgNode getEntry() {
		return entry;
	}

	public CfgNode getExit() {
		return exit;
	}

	/**
	 * @param id a node id
	 * @return the edges leaving the node
	 */
	public List<CfgEdge> getOutgoingEdges(int id) {
		return outgoing.get(id);
	}

	/**
	 * @param id a node id
	 * @return the edges entering the node
	 */
	public List<CfgEdge> getIncomingEdges(int id) {
		return incoming.get(id);
	}

	/**
	 * @return GOTO targets for which no label exists in the statement list
	 */
	public List<String> getUnresolvedLabels() {
		return unresolvedLabels;
	}

	/**
	 * Finds the first node whose label is {@code label}.
	 *
	 * @param label the label to look for
	 * @return the node, or {@code null}
	 */
	public CfgNode findNode(String label) {
		for (CfgNode node : nodes) {
			if (node.getLabel().equals(label)) {
				return node;
			}
		}
		return null;
	}

	/**
	 * Tells whether {@code to} can be reached from {@code from}, following
	 * edges depth-first. A node always reaches itself.
	 *
	 * @param from id of the start node
	 * @param to id of the target node
	 * @return whether a path exists
	 */
	public boolean hasPath(int from, int to) {
		getNode(from);
		getNode(to);
		return visit(from, to).get(to);
	}

	/**
	 * @param from the start node
	 * @param to the target node
	 * @return whether a path exists
	 */
	public boolean hasPath(CfgNode from, CfgNode to) {
		return hasPath(from.getId(), to.getId());
	}

	/**
	 * @return the nodes reachable from the entry node, ordered by id
	 */
	public List<CfgNode> getReachableNodes() {
		return select(visit(entry.getId(), -1), true);
	}

	/**
	 * @return the nodes that no path from the entry node reaches, ordered by id
	 */
	public List<CfgNode> getUnreachableNodes() {
		return select(visit(entry.getId(), -1), false);
	}

	/**
	 * @param id a node id
	 * @return whether a path from the entry node reaches this node
	 */
	public boolean isReachable(int id) {
		return hasPath(entry.getId(), id);
	}

	private List<CfgNode> select(BitSet visited, boolean reached) {
		List<CfgNode> result = new ArrayList<CfgNode>();
		for (CfgNode node : nodes) {
			if (visited.get(node.getId()) == reached) {
				result.add(node);
			}
		}
		return Collections.unmodifiableList(result);
	}

	/**
	 * Iterative depth-first search, stopping early once {@code target} is
	 * visited (pass -1 to visit everything reachable).
	 */
	private BitSet visit(int start, int target) {
		BitSet visited = new BitSet(nodes.size());
		Deque<Integer> stack = new ArrayDeque<Integer>();
		stack.push(start);
		while (!stack.isEmpty()) {
			int id = stack.pop();
			if (visited.get(id)) {
				continue;
			}
			visited.set(id);
			if (id == target) {
				break;
			}
			List<CfgEdge> out = outgoing.get(id);
			for (int i = out.size() - 1; i >= 0; i--) {
				int next = out.get(i).getTarget();
				if (!visited.get(next)) {
					stack.push(next);
				}
			}
		}
		return visited;
	}

	/**
	 * @return a line-oriented dump of the nodes and edges, stable for a given
	 *         statement list
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();
		for (CfgNode node : nodes) {
			desc.append(node).append('\n');
		}
		for (CfgEdge edge : edges) {
			desc.append(edge).append('\n');
		}
		return desc.toString();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return "ControlFlowGraph[nodes=" + nodes.size() + ", edges=" + edges.size() + "]";
	}
}
