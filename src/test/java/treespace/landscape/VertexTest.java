package treespace.landscape;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import treespace.bipartition.Bipartition;
import treespace.exceptions.TreeParseException;
import treespace.rearrangement.Topology;
import treespace.tree.PhyloTree;

public class VertexTest {

	protected Landscape ls;
	protected Vertex root;

	@Before
	public void prepareVertex() throws TreeParseException {
		ls = new Landscape(null, null, new PhyloTree("(((A,B),C),(D,E));"));
		root = ls.getVertex(0);
	}

	@Test
	public void readsThroughToLandscape() {
		assertEquals(0, root.getIndex());
		assertEquals("(A,(B,(C,(D,E))));", root.getNewick());
		assertEquals(root.getNewick(), root.getProperNewick());
		assertEquals(0, root.getDegree());
		assertFalse(root.isExplored());
		ls.exploreTree(0);
		assertTrue(root.isExplored());
		assertEquals(12, root.getNeighbors().length);
		assertEquals(12, root.getDegree());
		assertFalse(root.isFailed());
		assertFalse(root.isViolating());
		assertNull(root.getOrigin());
		assertEquals("SPR", ls.getVertex(root.getNeighbors()[0]).getOrigin());
	}

	@Test
	public void bipartitionsFollowPostOrder() {
		List<Bipartition> bis = root.getBipartitions();
		assertEquals(8, bis.size());
		for (int k = 0; k < bis.size(); k++) {
			assertEquals(ls.getBipartitionFoundInTreeByIndex(0, k), bis.get(k));
		}
		assertEquals(bis, root.getBipartitions());
		assertEquals(new Bipartition(null, Arrays.asList("A", "B"), Arrays.asList("C", "D", "E")), bis.get(6));
	}

	@Test
	public void neighborsOfBipartition() {
		Bipartition ab = root.getBipartitions().get(6);
		assertTrue(root.getNeighborsOfBipartition(ab).isEmpty());
		ls.exploreTree(0);
		List<Integer> found = root.getNeighborsOfBipartition(ab);
		assertEquals(2, found.size());
		List<Integer> neighbors = Arrays.asList(toObjects(root.getNeighbors()));
		assertTrue(neighbors.containsAll(found));
		assertEquals(found, root.getNeighborsOfBipartition(new Bipartition(null, Arrays.asList("C", "D", "E"), Arrays.asList("A", "B"))));

		Topology copy = root.getTree().toTopology();
		assertEquals(found, root.getNeighborsOfBranch(copy.getBranchFromBipartition(ab)));
	}

	@Test
	public void numberOfNeighbors() {
		assertEquals(24, root.approximatePossibleNumNeighbors());
	}

	@Test
	public void markedExplored() {
		root.markExplored();
		assertTrue(ls.getNode(0).isExplored());
		assertTrue(ls.exploreTree(0).isEmpty());
	}

	private static Integer[] toObjects(int[] ids) {
		Integer[] out = new Integer[ids.length];
		for (int i = 0; i < ids.length; i++) {
			out[i] = ids[i];
		}
		return out;
	}
}
