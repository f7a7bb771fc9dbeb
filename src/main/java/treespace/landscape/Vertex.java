package treespace.landscape;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import treespace.bipartition.Bipartition;
import treespace.constants.GeneralConstants;
import treespace.rearrangement.Rearrangement;
import treespace.rearrangement.RearrangementType;
import treespace.rearrangement.Topology;
import treespace.scoring.Score;
import treespace.tree.PhyloTree;
import treespace.tree.TreeBranch;
import treespace.tree.TreeNode;
import treespace.tree.TreeUtils;

/**
 * A view of one tree of a landscape. Vertices hold no state of their own and are cheap to make; every call reads
 * through to the landscape.
 */
public class Vertex {

	private final Landscape landscape;
	private final int index;

	Vertex(Landscape landscape, int index) {
		this.landscape = landscape;
		this.index = index;
	}

	public int getIndex() {return index;}

	public Landscape getLandscape() {return landscape;}

	public PhyloTree getTree() {return landscape.getTree(index);}

	public String getNewick() {return getTree().getNewick();}

	public String getProperNewick() {return getTree().getProperNewick();}

	public Score getScore() {return getTree().getScore();}

	public String getOrigin() {return getTree().getOrigin();}

	public int[] getNeighbors() {return landscape.getNeighborsFor(index);}

	public int getDegree() {return landscape.getDegreeFor(index);}

	public boolean isExplored() {return landscape.getNode(index).isExplored();}

	public boolean isFailed() {return landscape.getNode(index).isFailed();}

	/**
	 * Flag the tree as explored without adding its neighbors.
	 */
	public void markExplored() {landscape.getNode(index).markExplored();}

	public boolean isLocalOptimum() {return landscape.isLocalOptimum(index);}

	public boolean isViolating() {return landscape.isViolating(index);}

	public Double scoreLikelihood() {return landscape.scoreLikelihood(index);}

	public Integer getBestImprovement() {return landscape.getBestImprovement(index);}

	public List<Integer> getPathOfBestImprovement() {return landscape.getPathOfBestImprovement(index);}

	/**
	 * @return true if the given tree is this one's best improvement
	 */
	public boolean isBestImprovement(int other) {
		Integer best = getBestImprovement();
		return best != null && best == other;
	}

	/**
	 * @return the greatest number of distinct neighbors a tree of this size can have under the landscape's operator,
	 *		or LS_NOT_DEFINED if that is not known for the operator
	 */
	public int approximatePossibleNumNeighbors() {
		if (landscape.getOperator() != RearrangementType.SPR) {
			return (Integer) GeneralConstants.LS_NOT_DEFINED.value;
		}
		int n = getTree().toTopology().getNumLeaves();
		return 4 * (n - 3) * (n - 2);
	}

	/**
	 * One bipartition per branch of a fresh topology of the tree, in post-order of the nodes under the branches. The
	 * list is the same on every call, and position k is the branch that
	 * {@link Landscape#lockBranchFoundInTreeByIndex(int, int)} locks for index k.
	 */
	public List<Bipartition> getBipartitions() {
		Topology topology = getTree().toTopology();
		ArrayList<Bipartition> bis = new ArrayList<Bipartition>();
		for (TreeNode n : TreeUtils.postOrderTraversal(topology.getRoot())) {
			if (n.getParent() != null) {
				bis.add(new Bipartition(topology, n.getParent()));
			}
		}
		return bis;
	}

	/**
	 * @return ids, ascending, of the landscape trees that the SPR moves of the bipartition lead to; trees not in
	 *		the landscape are left out
	 */
	public List<Integer> getNeighborsOfBipartition(Bipartition bi) {
		Bipartition own = bi;
		if (bi.getBranch() == null || !getTree().getStructure().equals(bi.getTopology().toStructure())) {
			own = new Bipartition(getTree().toTopology(), bi.getLeft(), bi.getRight());
		}
		TreeSet<Integer> found = new TreeSet<Integer>();
		if (own.getBranch() == null) {
			return new ArrayList<Integer>(found);
		}
		for (Rearrangement r : own.getSPRRearrangements()) {
			Integer id = landscape.findTreeTopologyByStructure(r.toTree().getStructure());
			if (id != null && id != index) {
				found.add(id);
			}
		}
		return new ArrayList<Integer>(found);
	}

	/**
	 * @param br a branch of any copy of this vertex's tree
	 */
	public List<Integer> getNeighborsOfBranch(TreeBranch br) {
		return getNeighborsOfBipartition(Bipartition.matching(getTree().toTopology(), br));
	}

	@Override
	public String toString() {
		return "vertex " + index + " " + getNewick();
	}
}
