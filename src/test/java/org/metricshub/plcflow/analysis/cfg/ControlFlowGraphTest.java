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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.plcflow.SourceSpan;

public class ControlFlowGraphTest {

	private static CfgNode node(int id, NodeKind kind) {
		return new CfgNode(id, kind, kind.name(), SourceSpan.NONE, 0, 0);
	}

	private static CfgEdge edge(int source, int target, EdgeKind kind) {
		return new CfgEdge(source, target, kind);
	}

	private static ControlFlowGraph graph(List<CfgNode> nodes, CfgEdge... edges) {
		return new ControlFlowGraph(nodes, Arrays.asList(edges), Collections.<String>emptyList());
	}

	/**
	 * ENTRY -> BRANCH -(true)-> BASIC -> EXIT, BRANCH -(false)-> EXIT
	 */
	private static ControlFlowGraph diamond() {
		return graph(
				Arrays.asList(node(0, NodeKind.ENTRY), node(1, NodeKind.BRANCH), node(2, NodeKind.BASIC), node(3, NodeKind.EXIT)),
				edge(0, 1, EdgeKind.SEQUENTIAL),
				edge(1, 2, EdgeKind.TRUE_BRANCH),
				edge(1, 3, EdgeKind.FALSE_BRANCH),
				edge(2, 3, EdgeKind.SEQUENTIAL));
	}

	@Test
	public void testAccessors() {
		ControlFlowGraph graph = diamond();
		assertEquals(0, graph.getEntry().getId());
		assertEquals(3, graph.getExit().getId());
		assertEquals(2, graph.getOutgoingEdges(1).size());
		assertEquals(2, graph.getIncomingEdges(3).size());
		assertSame(graph.getNode(2), graph.findNode("BASIC"));
		assertNull(graph.findNode("nothing"));
		assertEquals("ControlFlowGraph[nodes=4, edges=4]", graph.toString());
		assertEquals("1:BRANCH[BRANCH]", graph.getNode(1).toString());
		assertEquals("1 -FALSE_BRANCH-> 3", graph.getEdges().get(2).toString());
		assertThrows(UnsupportedOperationException.class, () -> graph.getNodes().clear());
		assertThrows(UnsupportedOperationException.class, () -> graph.getEdges().clear());
	}

	@Test
	public void testInputListsAreCopied() {
		List<CfgNode> nodes = new ArrayList<CfgNode>(Arrays.asList(node(0, NodeKind.ENTRY), node(1, NodeKind.EXIT)));
		ControlFlowGraph graph = graph(nodes, edge(0, 1, EdgeKind.SEQUENTIAL));
		nodes.clear();
		assertEquals(2, graph.getNodes().size());
	}

	@Test
	public void testPaths() {
		ControlFlowGraph graph = diamond();
		assertTrue(graph.hasPath(0, 3));
		assertTrue(graph.hasPath(graph.getNode(1), graph.getNode(2)));
		assertTrue("A node reaches itself", graph.hasPath(2, 2));
		assertFalse(graph.hasPath(3, 0));
		assertFalse(graph.hasPath(2, 1));
		assertEquals(4, graph.getReachableNodes().size());
		assertTrue(graph.getUnreachableNodes().isEmpty());
		assertThrows(IndexOutOfBoundsException.class, () -> graph.hasPath(0, 4));
	}

	@Test
	public void testUnreachableNodes() {
		ControlFlowGraph graph = graph(
				Arrays.asList(node(0, NodeKind.ENTRY), node(1, NodeKind.BASIC), node(2, NodeKind.BASIC), node(3, NodeKind.EXIT)),
				edge(0, 1, EdgeKind.SEQUENTIAL),
				edge(1, 3, EdgeKind.RETURN),
				edge(2, 3, EdgeKind.SEQUENTIAL));
		assertEquals(Collections.singletonList(graph.getNode(2)), graph.getUnreachableNodes());
		assertTrue(graph.isReachable(3));
		assertFalse(graph.isReachable(2));
	}

	@Test
	public void testLoopHeaderNeedsOneLoopBack() {
		List<CfgNode> nodes = Arrays
				.asList(
						node(0, NodeKind.ENTRY),
						node(1, NodeKind.LOOP_HEADER),
						node(2, NodeKind.BASIC),
						node(3, NodeKind.LOOP_EXIT),
						node(4, NodeKind.EXIT));
		ControlFlowGraph loop = graph(
				nodes,
				edge(0, 1, EdgeKind.SEQUENTIAL),
				edge(1, 2, EdgeKind.TRUE_BRANCH),
				edge(2, 1, EdgeKind.LOOP_BACK),
				edge(1, 3, EdgeKind.LOOP_EXIT),
				edge(3, 4, EdgeKind.SEQUENTIAL));
		assertTrue(loop.hasPath(2, 4));

		assertThrows(
				IllegalStateException.class,
				() -> graph(
						nodes,
						edge(0, 1, EdgeKind.SEQUENTIAL),
						edge(1, 2, EdgeKind.TRUE_BRANCH),
						edge(2, 1, EdgeKind.SEQUENTIAL),
						edge(1, 3, EdgeKind.LOOP_EXIT),
						edge(3, 4, EdgeKind.SEQUENTIAL)));
	}

	@Test
	public void testHeaderTestedAfterTheBody() {
		List<CfgNode> nodes = Arrays
				.asList(
						node(0, NodeKind.ENTRY),
						node(1, NodeKind.BASIC),
						node(2, NodeKind.LOOP_HEADER),
						node(3, NodeKind.LOOP_EXIT),
						node(4, NodeKind.EXIT));
		ControlFlowGraph loop = graph(
				nodes,
				edge(0, 1, EdgeKind.SEQUENTIAL),
				edge(1, 2, EdgeKind.SEQUENTIAL),
				edge(2, 1, EdgeKind.LOOP_BACK),
				edge(2, 3, EdgeKind.LOOP_EXIT),
				edge(3, 4, EdgeKind.SEQUENTIAL));
		assertTrue(loop.hasPath(2, 1));
		assertTrue(loop.hasPath(1, 4));

		// a second LOOP_BACK, coming in
		assertThrows(
				IllegalStateException.class,
				() -> graph(
						Arrays.asList(node(0, NodeKind.ENTRY), node(1, NodeKind.LOOP_HEADER), node(2, NodeKind.LOOP_EXIT), node(3, NodeKind.EXIT)),
						edge(0, 1, EdgeKind.LOOP_BACK),
						edge(1, 1, EdgeKind.LOOP_BACK),
						edge(1, 2, EdgeKind.LOOP_EXIT),
						edge(2, 3, EdgeKind.SEQUENTIAL)));
	}

	@Test
	public void testMalformedGraphsAreRejected() {
		CfgNode entry = node(0, NodeKind.ENTRY);
		CfgNode exit = node(1, NodeKind.EXIT);

		// no exit
		assertThrows(IllegalStateException.class, () -> graph(Arrays.asList(entry)));
		// two entries
		assertThrows(
				IllegalStateException.class,
				() -> graph(
						Arrays.asList(entry, node(1, NodeKind.ENTRY), node(2, NodeKind.EXIT)),
						edge(0, 2, EdgeKind.SEQUENTIAL),
						edge(1, 2, EdgeKind.SEQUENTIAL)));
		// ids out of order
		assertThrows(IllegalStateException.class, () -> graph(Arrays.asList(exit, entry), edge(0, 1, EdgeKind.SEQUENTIAL)));
		// unknown target
		assertThrows(IllegalStateException.class, () -> graph(Arrays.asList(entry, exit), edge(0, 2, EdgeKind.SEQUENTIAL)));
		// entry without successor
		assertThrows(IllegalStateException.class, () -> graph(Arrays.asList(entry, exit)));
		// exit with a successor
		assertThrows(
				IllegalStateException.class,
				() -> graph(
						Arrays.asList(entry, node(1, NodeKind.BASIC), node(2, NodeKind.EXIT)),
						edge(0, 1, EdgeKind.SEQUENTIAL),
						edge(1, 2, EdgeKind.SEQUENTIAL),
						edge(2, 1, EdgeKind.SEQUENTIAL)));
		// edge into the entry
		assertThrows(
				IllegalStateException.class,
				() -> graph(
						Arrays.asList(entry, node(1, NodeKind.BASIC), exit(2)),
						edge(0, 1, EdgeKind.SEQUENTIAL),
						edge(1, 0, EdgeKind.SEQUENTIAL)));
		// branch with two true edges
		assertThrows(
				IllegalStateException.class,
				() -> graph(
						Arrays.asList(entry, node(1, NodeKind.BRANCH), exit(2)),
						edge(0, 1, EdgeKind.SEQUENTIAL),
						edge(1, 2, EdgeKind.TRUE_BRANCH),
						edge(1, 2, EdgeKind.TRUE_BRANCH)));
		// basic node with two successors
		assertThrows(
				IllegalStateException.class,
				() -> graph(
						Arrays.asList(entry, node(1, NodeKind.BASIC), exit(2)),
						edge(0, 1, EdgeKind.SEQUENTIAL),
						edge(1, 2, EdgeKind.SEQUENTIAL),
						edge(1, 2, EdgeKind.RETURN)));
	}

	private static CfgNode exit(int id) {
		return node(id, NodeKind.EXIT);
	}

	@Test
	public void testEdgeRequiresAKind() {
		assertThrows(IllegalArgumentException.class, () -> new CfgEdge(0, 1, null));
		assertEquals(edge(0, 1, EdgeKind.RETURN), edge(0, 1, EdgeKind.RETURN));
		assertFalse(edge(0, 1, EdgeKind.RETURN).equals(edge(0, 1, EdgeKind.SEQUENTIAL)));
	}
}
