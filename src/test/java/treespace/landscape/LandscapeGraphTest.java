package treespace.landscape;

import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Test;

public class LandscapeGraphTest {

	protected LandscapeGraph g;

	@Before
	public void prepareGraph() {
		g = new LandscapeGraph();
		for (int i = 0; i < 5; i++) {
			g.addNode(i);
		}
		g.addEdge(0, 1, 1.0);
		g.addEdge(1, 2, 1.0);
		g.addEdge(3, 4, 2.0);
	}

	@Test
	public void edgesAreUndirected() {
		assertTrue(g.hasEdge(1, 0));
		assertEquals(2.0, g.getEdgeWeight(4, 3), 0.0);
		assertArrayEquals(new int[] {0, 2}, g.getNeighbors(1));
		assertEquals(3, g.getNumEdges());
		assertEquals(3, g.getEdges().size());
	}

	@Test
	public void existingEdgeKeepsWeight() {
		assertFalse(g.addEdge(1, 0, 5.0));
		assertEquals(1.0, g.getEdgeWeight(0, 1), 0.0);
		g.setEdgeWeight(0, 1, 5.0);
		assertEquals(5.0, g.getEdgeWeight(1, 0), 0.0);
		g.setAllEdgeWeights(0.0);
		assertEquals(0.0, g.getEdgeWeight(3, 4), 0.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void noSelfLoops() {
		g.addEdge(2, 2, 1.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void unknownNode() {
		g.getNeighbors(9);
	}

	@Test
	public void components() {
		assertEquals(2, g.getNumComponents());
		assertTrue(g.hasPath(0, 2));
		assertFalse(g.hasPath(0, 4));
		assertArrayEquals(new int[] {0, 1, 2}, g.getShortestPath(0, 2));
		assertArrayEquals(new int[] {3}, g.getShortestPath(3, 3));
		assertNull(g.getShortestPath(2, 3));
	}

	@Test
	public void removingNodeRemovesEdges() {
		assertTrue(g.removeNode(1));
		assertFalse(g.removeNode(1));
		assertEquals(0, g.getDegree(0));
		assertEquals(3, g.getNumComponents());
		assertArrayEquals(new int[] {0, 2, 3, 4}, g.getNodes());
	}
}
