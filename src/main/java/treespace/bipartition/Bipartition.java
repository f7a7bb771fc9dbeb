package treespace.bipartition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import treespace.exceptions.RearrangementException;
import treespace.landscape.Landscape;
import treespace.rearrangement.Rearrangement;
import treespace.rearrangement.Topology;
import treespace.tree.PhyloTree;
import treespace.tree.TreeBranch;
import treespace.tree.TreeNode;
import treespace.tree.TreeUtils;

/**
 * The split of the leaves of a topology made by removing one branch. The right side holds the leaves under the
 * branch, the left side the rest. Both sides are kept sorted.
 *
 * Two bipartitions are equal when they have the same two sides, in either order. The hash code is taken from a
 * short form in which every label is replaced by one symbol.
 */
public class Bipartition {

	private final Topology topology;
	private final TreeBranch branch;
	private final List<String> left;
	private final List<String> right;
	private final String shortRep;

	private Set<TreeBranch> branchSide;
	private Set<TreeBranch> otherSide;
	private List<Rearrangement> sprRearrangements;

	public Bipartition(Topology topology, TreeBranch branch) {
		if (topology == null) {
			throw new IllegalArgumentException("a bipartition of a branch needs its topology");
		}
		this.topology = topology;
		this.branch = branch;
		List<List<String>> sides = topology.getStrBipartitionFromBranch(branch);
		this.left = Collections.unmodifiableList(sides.get(0));
		this.right = Collections.unmodifiableList(sides.get(1));
		this.shortRep = makeShortRepresentation();
	}

	/**
	 * Build a bipartition from its two sides. If a topology is given, the branch making this split is looked up in
	 * it; {@link #getBranch()} returns null when there is none.
	 */
	public Bipartition(Topology topology, List<String> left, List<String> right) {
		ArrayList<String> l = new ArrayList<String>(left);
		ArrayList<String> r = new ArrayList<String>(right);
		Collections.sort(l);
		Collections.sort(r);
		this.topology = topology;
		this.left = Collections.unmodifiableList(l);
		this.right = Collections.unmodifiableList(r);
		this.branch = topology == null ? null : topology.getBranchFromStrBipartition(l, r);
		this.shortRep = makeShortRepresentation();
	}

	public static Bipartition fromStringRepresentation(Topology topology, List<String> left, List<String> right) {
		return new Bipartition(topology, left, right);
	}

	/**
	 * @param foreign a branch of another copy of the same tree
	 * @return the bipartition of the topology making the same split as the foreign branch; its branch is null if the
	 *		topology has no such split
	 */
	public static Bipartition matching(Topology topology, TreeBranch foreign) {
		List<String> below = TreeUtils.getLeafLabels(foreign.getChild());
		ArrayList<String> rest = new ArrayList<String>(topology.getLeafLabels());
		rest.removeAll(below);
		return new Bipartition(topology, rest, below);
	}

	public Topology getTopology() {return topology;}

	/**
	 * @return the branch making this split, or null if it was built from labels that no branch of its topology splits
	 */
	public TreeBranch getBranch() {return branch;}

	public List<String> getLeft() {return left;}

	public List<String> getRight() {return right;}

	/**
	 * @return the two sorted sides, left first
	 */
	public List<List<String>> getStringRepresentation() {
		return Arrays.asList(left, right);
	}

	/**
	 * @return the larger side then the smaller, as symbols A, B, C... given to the labels in sorted order,
	 *		separated by ':'
	 */
	public String getShortRepresentation() {return shortRep;}

	private String makeShortRepresentation() {
		List<String> big = left;
		List<String> small = right;
		// sides of equal size are ordered by their labels so that swapped sides give the same string
		if (right.size() > left.size() || (right.size() == left.size() && compare(right, left) < 0)) {
			big = right;
			small = left;
		}
		ArrayList<String> labels = new ArrayList<String>(left);
		labels.addAll(right);
		Collections.sort(labels);
		HashMap<String, Character> symbols = new HashMap<String, Character>();
		for (int i = 0; i < labels.size(); i++) {
			symbols.put(labels.get(i), (char) ('A' + i));
		}
		StringBuffer s = new StringBuffer();
		for (String l : big) {
			s.append(symbols.get(l));
		}
		s.append(":");
		for (String l : small) {
			s.append(symbols.get(l));
		}
		return s.toString();
	}

	private static int compare(List<String> a, List<String> b) {
		for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
			int c = a.get(i).compareTo(b.get(i));
			if (c != 0) {
				return c;
			}
		}
		return a.size() - b.size();
	}

	/*
	 * branch lists
	 */

	private void requireBranch() {
		if (branch == null) {
			throw new RearrangementException("bipartition " + this + " has no branch in its topology");
		}
	}

	/**
	 * @return two sets: the branch with every branch under it, and all other branches of the topology
	 */
	public List<Set<TreeBranch>> getBranchListRepresentation() {
		return Arrays.asList(getBranchSide(), getOtherSide());
	}

	public Set<TreeBranch> getBranchSide() {
		if (branchSide == null) {
			requireBranch();
			LinkedHashSet<TreeBranch> l = new LinkedHashSet<TreeBranch>();
			l.add(branch);
			l.addAll(TreeUtils.getAllBranches(branch));
			LinkedHashSet<TreeBranch> r = new LinkedHashSet<TreeBranch>(topology.getBranches());
			r.removeAll(l);
			branchSide = Collections.unmodifiableSet(l);
			otherSide = Collections.unmodifiableSet(r);
		}
		return branchSide;
	}

	public Set<TreeBranch> getOtherSide() {
		getBranchSide();
		return otherSide;
	}

	public boolean isOnBranchSide(TreeBranch br) {
		return getBranchSide().contains(br);
	}

	/**
	 * @return the position, in post-order, of the node under this bipartition's branch
	 */
	public int getBranchIndex() {
		requireBranch();
		List<TreeNode> nodes = TreeUtils.postOrderTraversal(topology.getRoot());
		for (int i = 0; i < nodes.size(); i++) {
			if (nodes.get(i) == branch.getChild()) {
				return i;
			}
		}
		throw new IllegalStateException("branch is no longer part of its topology");
	}

	/*
	 * rearrangements of this bipartition
	 */

	public List<Rearrangement> getSPRRearrangements() {
		if (sprRearrangements == null) {
			requireBranch();
			sprRearrangements = topology.allSPRForBranch(branch);
		}
		return sprRearrangements;
	}

	/**
	 * Collect the likelihoods of the landscape neighbors of a tree that this bipartition's SPR moves lead to. Nothing
	 * is scored here; unscored neighbors are skipped.
	 *
	 * @param vertex landscape id of this bipartition's tree, or null to look it up by structure
	 */
	public List<Double> getSPRScores(Landscape landscape, Integer vertex) {
		ArrayList<Double> scores = new ArrayList<Double>();
		Integer start = vertex;
		if (start == null) {
			start = landscape.findTreeTopologyByStructure(topology.toStructure());
			if (start == null) {
				return scores;
			}
		}
		HashSet<String> results = new HashSet<String>();
		for (Rearrangement r : getSPRRearrangements()) {
			results.add(r.toTree().getStructure());
		}
		for (int n : landscape.getNeighborsFor(start)) {
			PhyloTree t = landscape.getTree(n);
			if (results.contains(t.getStructure()) && t.getLikelihood() != null) {
				scores.add(t.getLikelihood());
			}
		}
		return scores;
	}

	/**
	 * @return the median of {@link #getSPRScores(Landscape, Integer)}, or null if there are none
	 */
	public Double getMedianSPRScore(Landscape landscape, Integer vertex) {
		List<Double> scores = getSPRScores(landscape, vertex);
		if (scores.isEmpty()) {
			return null;
		}
		Collections.sort(scores);
		int mid = scores.size() / 2;
		if (scores.size() % 2 == 1) {
			return scores.get(mid);
		}
		return (scores.get(mid - 1) + scores.get(mid)) / 2;
	}

	/**
	 * @return the highest of {@link #getSPRScores(Landscape, Integer)}, or null if there are none
	 */
	public Double getBestSPRScore(Landscape landscape, Integer vertex) {
		List<Double> scores = getSPRScores(landscape, vertex);
		if (scores.isEmpty()) {
			return null;
		}
		return Collections.max(scores);
	}

	@Override
	public boolean equals(Object that) {
		boolean result = false;
		if (that instanceof Bipartition) {
			Bipartition b = (Bipartition) that;
			result = (left.equals(b.left) && right.equals(b.right)) || (left.equals(b.right) && right.equals(b.left));
		}
		return result;
	}

	@Override
	public int hashCode() {
		return shortRep.hashCode();
	}

	@Override
	public String toString() {
		StringBuffer s = new StringBuffer();
		s.append("{");
		s.append(StringUtils.join(left, ", "));
		s.append("} | {");
		s.append(StringUtils.join(right, ", "));
		s.append("}");
		return s.toString();
	}
}
