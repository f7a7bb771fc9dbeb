package treespace.tree;

import java.util.HashMap;
import java.util.List;

import treespace.exceptions.TreeParseException;
import treespace.rearrangement.Topology;
import treespace.scoring.Score;

/**
 * A tree as stored in a landscape or tree set: its newick string, its structure (the canonical newick without
 * branch lengths, used as identity), a name, the tag of the operation that produced it, and its score.
 */
public class PhyloTree {

	private String name;
	private String newick;
	private String structure;
	private String origin;
	private Score score;

	/**
	 * Reads the newick string and puts it in canonical form.
	 */
	public PhyloTree(String newick) throws TreeParseException {
		this(newick, true);
	}

	/**
	 * @param check if true the tree is rerooted at its smallest leaf and its interior labels are dropped; if false
	 *		the newick string is trusted to already be canonical
	 */
	public PhyloTree(String newick, boolean check) throws TreeParseException {
		this.name = "";
		this.origin = null;
		this.score = Score.UNSCORED;
		if (check) {
			Topology t = Topology.fromNewick(newick);
			this.newick = t.toNewick();
			this.structure = t.toStructure();
		} else {
			TreeNode root = new TreeReader().readTree(newick);
			this.newick = newick.trim();
			this.structure = TreeUtils.toNewick(root, false);
		}
	}

	private PhyloTree(String name, String newick, String structure, String origin, Score score) {
		this.name = name;
		this.newick = newick;
		this.structure = structure;
		this.origin = origin;
		this.score = score;
	}

	public String getName() {return name;}

	public void setName(String name) {this.name = name == null ? "" : name;}

	public String getNewick() {return newick;}

	/**
	 * @return the newick string with branch lengths
	 */
	public String getProperNewick() {return newick;}

	public String getStructure() {return structure;}

	/**
	 * @return the tag of the rearrangement or source that produced this tree, or null
	 */
	public String getOrigin() {return origin;}

	public void setOrigin(String origin) {this.origin = origin;}

	public Score getScore() {return score;}

	public void setScore(Score score) {this.score = score == null ? Score.UNSCORED : score;}

	public Double getLikelihood() {return score.getLikelihood();}

	public Double getParsimony() {return score.getParsimony();}

	/**
	 * Replace the newick string, typically to carry new branch lengths.
	 * @throws IllegalArgumentException if the new string has a different structure
	 */
	public void updateNewick(String newick) throws TreeParseException {
		Topology t = Topology.fromNewick(newick);
		if (!t.toStructure().equals(structure)) {
			throw new IllegalArgumentException("new newick string changes the tree structure: " + newick);
		}
		this.newick = t.toNewick();
	}

	/**
	 * @return the newick string with every leaf label replaced by its 1-based rank among the sorted labels
	 */
	public String getSimpleNewick() {
		TreeNode root = readOwnNewick();
		List<String> labels = TreeUtils.getLeafLabels(root);
		HashMap<String, String> ranks = new HashMap<String, String>();
		for (int i = 0; i < labels.size(); i++) {
			ranks.put(labels.get(i), String.valueOf(i + 1));
		}
		for (TreeNode leaf : TreeUtils.getAllLeaves(root)) {
			leaf.setLabel(ranks.get(leaf.getLabel()));
		}
		return TreeUtils.toNewick(root, true);
	}

	/**
	 * @return this tree if it is already rerooted and sorted, otherwise a canonical copy with the same name, origin
	 *		and score
	 */
	public PhyloTree toCanonical() {
		Topology t = toTopology();
		String canonical = t.toNewick();
		String canonicalStructure = t.toStructure();
		if (canonical.equals(newick) && canonicalStructure.equals(structure)) {
			return this;
		}
		return new PhyloTree(name, canonical, canonicalStructure, origin, score);
	}

	public Topology toTopology() {
		try {
			return Topology.fromNewick(newick);
		} catch (TreeParseException tpe) {
			throw new IllegalStateException("stored newick string can no longer be read: " + newick, tpe);
		}
	}

	public String toUnrootedNewick() {
		return toTopology().toUnrootedNewick();
	}

	private TreeNode readOwnNewick() {
		try {
			return new TreeReader().readTree(newick);
		} catch (TreeParseException tpe) {
			throw new IllegalStateException("stored newick string can no longer be read: " + newick, tpe);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof PhyloTree)) {
			return false;
		}
		return structure.equals(((PhyloTree) o).structure);
	}

	@Override
	public int hashCode() {
		return structure.hashCode();
	}

	@Override
	public String toString() {
		return newick;
	}
}
