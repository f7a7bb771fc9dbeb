package treespace.bipartition;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import treespace.exceptions.RearrangementException;
import treespace.exceptions.TreeParseException;
import treespace.landscape.Landscape;
import treespace.rearrangement.Rearrangement;
import treespace.rearrangement.Topology;
import treespace.tree.PhyloTree;
import treespace.tree.TreeBranch;

public class BipartitionTest {

	protected Topology five;
	protected TreeBranch cde;

	@Before
	public void prepareTopology() throws TreeParseException {
		five = Topology.fromNewick("(A,(B,(C,(D,E))));");
		cde = five.getBranchFromStrBipartition(Arrays.asList("A", "B"), Arrays.asList("C", "D", "E"));
	}

	@Test
	public void sidesOfBranch() {
		Bipartition bi = new Bipartition(five, cde);
		assertEquals(Arrays.asList("A", "B"), bi.getLeft());
		assertEquals(Arrays.asList("C", "D", "E"), bi.getRight());
		assertSame(cde, bi.getBranch());
		assertEquals("{A, B} | {C, D, E}", bi.toString());
	}

	@Test
	public void symmetric() {
		List<String> l = Arrays.asList("A", "B");
		List<String> r = Arrays.asList("C", "D", "E");
		Bipartition lr = new Bipartition(null, l, r);
		Bipartition rl = new Bipartition(null, r, l);
		assertEquals(lr, rl);
		assertEquals(rl, lr);
		assertEquals(lr.hashCode(), rl.hashCode());
		assertEquals(lr, new Bipartition(five, cde));
		assertFalse(lr.equals(new Bipartition(null, Arrays.asList("A", "C"), Arrays.asList("B", "D", "E"))));
	}

	@Test
	public void shortRepresentation() {
		assertEquals("CDE:AB", new Bipartition(null, Arrays.asList("B", "A"), Arrays.asList("E", "C", "D")).getShortRepresentation());
		assertEquals("AB:CD", new Bipartition(null, Arrays.asList("z", "y"), Arrays.asList("w", "x")).getShortRepresentation());
		assertEquals("AB:CD", new Bipartition(null, Arrays.asList("w", "x"), Arrays.asList("z", "y")).getShortRepresentation());
	}

	@Test
	public void resolvesBranchFromLabels() {
		Bipartition bi = Bipartition.fromStringRepresentation(five, Arrays.asList("C", "D", "E"), Arrays.asList("B", "A"));
		assertSame(cde, bi.getBranch());
		assertNull(Bipartition.fromStringRepresentation(five, Arrays.asList("A", "C"), Arrays.asList("B", "D", "E")).getBranch());
	}

	@Test
	public void matchesBranchOfAnotherCopy() throws TreeParseException {
		Topology copy = Topology.fromNewick(five.toNewick());
		TreeBranch foreign = copy.getBranchFromStrBipartition(Arrays.asList("A", "B"), Arrays.asList("C", "D", "E"));
		assertSame(cde, Bipartition.matching(five, foreign).getBranch());
	}

	@Test(expected = RearrangementException.class)
	public void unresolvedHasNoBranchSide() {
		Bipartition.fromStringRepresentation(five, Arrays.asList("A", "C"), Arrays.asList("B", "D", "E")).getBranchSide();
	}

	@Test
	public void branchLists() {
		Bipartition bi = new Bipartition(five, cde);
		assertEquals(5, bi.getBranchSide().size());
		assertEquals(3, bi.getOtherSide().size());
		assertTrue(bi.isOnBranchSide(cde));
		assertTrue(bi.getOtherSide().contains(five.getAnchorBranch()));
		assertEquals(2, bi.getBranchListRepresentation().size());
	}

	@Test
	public void branchIndexInPostOrder() {
		assertEquals(6, new Bipartition(five, cde).getBranchIndex());
		assertEquals(0, new Bipartition(five, five.getAnchorBranch()).getBranchIndex());
	}

	@Test
	public void sprScoresComeFromLandscapeNeighbors() throws TreeParseException {
		Bipartition bi = new Bipartition(five, cde);
		List<Rearrangement> moves = bi.getSPRRearrangements();
		assertEquals(2, moves.size());
		assertSame(moves, bi.getSPRRearrangements());

		Landscape ls = new Landscape(null, null, new PhyloTree(five.toNewick()));
		assertNull(bi.getBestSPRScore(ls, 0));
		ls.exploreTree(0);
		double best = Double.NEGATIVE_INFINITY;
		double sum = 0;
		for (Rearrangement r : moves) {
			int id = ls.findTreeTopologyByStructure(r.toTree().getStructure());
			PhyloTree t = ls.getTree(id);
			t.setScore(t.getScore().withLikelihood(-10.0 - id));
			best = Math.max(best, -10.0 - id);
			sum += -10.0 - id;
		}
		assertEquals(2, bi.getSPRScores(ls, 0).size());
		assertEquals(2, bi.getSPRScores(ls, null).size());
		assertEquals(best, bi.getBestSPRScore(ls, 0), 1e-9);
		assertEquals(sum / 2, bi.getMedianSPRScore(ls, 0), 1e-9);
	}
}
