package treespace.rearrangement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import treespace.bipartition.Bipartition;
import treespace.constants.GeneralConstants;
import treespace.exceptions.RearrangementException;
import treespace.exceptions.TreeParseException;
import treespace.tree.PhyloTree;
import treespace.tree.TreeBranch;
import treespace.tree.TreeNode;
import treespace.tree.TreeReader;
import treespace.tree.TreeUtils;

/**
 * A tree topology in canonical form, together with the machinery to rearrange it.
 *
 * On construction the tree is rerooted so that one leaf (by default the one with the smallest label) hangs directly
 * off a new two-child root. The other root branch, the "fake" branch, carries the rest of the tree. Nodes left with a
 * single child are smoothed away and interior labels are cleared. Two trees with the same unrooted shape therefore
 * produce the same newick string, which is what landscapes use to recognize topologies they have already seen.
 *
 * The leaf branch at the root (the anchor) is always locked. Further bipartitions can be locked with
 * {@link #lockBranch(TreeBranch)}; no move offered or accepted by this topology crosses a locked bipartition.
 *
 * Moves never change this object. A move is applied to the tree in place, the result is written out, and the tree is
 * put back before the call returns.
 */
public class Topology {

	private static final Logger _LOG = Logger.getLogger(Topology.class);

	private TreeNode root;
	private TreeBranch anchor;
	private TreeBranch fake;
	private ArrayList<TreeBranch> branches;
	private HashMap<TreeBranch, HashSet<TreeBranch>> forbidden;
	private ArrayList<Bipartition> locks;
	private List<String> leafLabels;
	private HashMap<TreeBranch, List<String>> labelsBelow;

	/**
	 * Canonicalize the tree rooted at the given node, anchoring at the leaf with the smallest label. The nodes and
	 * branches of the given tree are taken over and rearranged.
	 */
	public Topology(TreeNode tree) {
		this(tree, null);
	}

	/**
	 * @param anchorLabel label of the leaf to hang off the root, or null for the smallest label
	 * @throws IllegalArgumentException if the tree has fewer than two leaves or no leaf has the given label
	 */
	public Topology(TreeNode tree, String anchorLabel) {
		reroot(tree, anchorLabel);
		for (TreeNode n : TreeUtils.postOrderTraversal(root)) {
			if (n.isInternal()) {
				n.clearLabel();
			}
		}
		branches = new ArrayList<TreeBranch>(TreeUtils.getAllBranches(root));
		leafLabels = TreeUtils.getLeafLabels(root);
		labelsBelow = new HashMap<TreeBranch, List<String>>();
		setForbidden();
		locks = new ArrayList<Bipartition>();
		lockBranch(anchor);
	}

	public static Topology fromNewick(String newick) throws TreeParseException {
		return new Topology(new TreeReader().readTree(newick));
	}

	public static Topology fromNewick(String newick, String anchorLabel) throws TreeParseException {
		return new Topology(new TreeReader().readTree(newick), anchorLabel);
	}

	/*
	 * rerooting
	 */

	private void reroot(TreeNode tree, String anchorLabel) {
		// a root with one child carries no information
		while (tree.getChildCount() == 1) {
			tree = tree.getChild(0).getChild();
			tree.setParent(null);
		}
		TreeUtils.removeUnaryInternalNodes(tree);

		List<TreeNode> leaves = TreeUtils.getAllLeaves(tree);
		if (leaves.size() < 2) {
			throw new IllegalArgumentException("a topology needs at least two leaves");
		}
		TreeNode leaf = null;
		for (TreeNode l : leaves) {
			if (anchorLabel == null) {
				if (leaf == null || l.getLabel().compareTo(leaf.getLabel()) < 0) {
					leaf = l;
				}
			} else if (l.getLabel().equals(anchorLabel)) {
				leaf = l;
				break;
			}
		}
		if (leaf == null) {
			throw new IllegalArgumentException("no leaf labelled '" + anchorLabel + "' to root at");
		}

		TreeBranch leafBranch = leaf.getParent();
		TreeNode closest = leafBranch.getParent();
		TreeUtils.reverseToRoot(closest);
		closest.removeChild(leafBranch);

		root = new TreeNode();
		root.addChild(leafBranch);
		double fakeLength = (Double) GeneralConstants.FAKE_BRANCH_LENGTH.value;
		root.addChild(new TreeBranch(closest, fakeLength, root));
		closest.setParent(root.getChild(1));
		TreeUtils.removeUnaryInternalNodes(root);

		anchor = root.getChild(0);
		fake = root.getChild(1);
	}

	// subtree, siblings, parent, and the branch itself
	private void setForbidden() {
		forbidden = new HashMap<TreeBranch, HashSet<TreeBranch>>();
		for (TreeBranch br : branches) {
			HashSet<TreeBranch> f = new HashSet<TreeBranch>(TreeUtils.getAllBranches(br));
			f.add(br);
			for (TreeBranch sib : br.getParent().getChildren()) {
				f.add(sib);
			}
			TreeBranch up = br.getParent().getParent();
			if (up != null) {
				f.add(up);
			}
			forbidden.put(br, f);
		}
	}

	/*
	 * accessors
	 */

	public TreeNode getRoot() {return root;}

	/**
	 * @return the locked leaf branch hanging off the root
	 */
	public TreeBranch getAnchorBranch() {return anchor;}

	public String getAnchorLabel() {return anchor.getChild().getLabel();}

	/**
	 * @return the root branch carrying everything but the anchor leaf
	 */
	public TreeBranch getFakeBranch() {return fake;}

	/**
	 * @return every branch of the tree, each listed before the branches under it, the two root branches first
	 */
	public List<TreeBranch> getBranches() {return Collections.unmodifiableList(branches);}

	public List<TreeNode> getLeaves() {return TreeUtils.getAllLeaves(root);}

	/**
	 * @return the sorted labels of all leaves
	 */
	public List<String> getLeafLabels() {return Collections.unmodifiableList(leafLabels);}

	public int getNumLeaves() {return leafLabels.size();}

	/**
	 * @return the sorted labels of the leaves under the given branch
	 */
	public List<String> getLabelsBelow(TreeBranch br) {
		List<String> below = labelsBelow.get(br);
		if (below == null) {
			below = Collections.unmodifiableList(TreeUtils.getLeafLabels(br.getChild()));
			labelsBelow.put(br, below);
		}
		return below;
	}

	/**
	 * @return the destinations the given branch may never be moved to
	 */
	public Set<TreeBranch> getForbidden(TreeBranch br) {
		return Collections.unmodifiableSet(checkBranch(br));
	}

	/**
	 * @return the branches on the same side of every lock as the given branch, in branch order
	 */
	public Set<TreeBranch> getPartition(TreeBranch br) {
		LinkedHashSet<TreeBranch> possible = new LinkedHashSet<TreeBranch>(branches);
		for (Bipartition lock : locks) {
			if (lock.isOnBranchSide(br)) {
				possible.removeAll(lock.getOtherSide());
			} else {
				possible.removeAll(lock.getBranchSide());
			}
		}
		return possible;
	}

	private HashSet<TreeBranch> checkBranch(TreeBranch br) {
		HashSet<TreeBranch> f = forbidden.get(br);
		if (f == null) {
			throw new RearrangementException("branch does not belong to this topology");
		}
		return f;
	}

	/*
	 * bipartitions and locks
	 */

	/**
	 * @return the bipartition of every branch, in post-order of the nodes below them; the root has none
	 */
	public List<Bipartition> getBipartitions() {
		ArrayList<Bipartition> out = new ArrayList<Bipartition>();
		for (TreeNode n : TreeUtils.postOrderTraversal(root)) {
			if (n.getParent() != null) {
				out.add(new Bipartition(this, n.getParent()));
			}
		}
		return out;
	}

	/**
	 * @return the two sides of the split made by the given branch: first the leaves not under it, then the leaves
	 *		under it, both sorted
	 */
	public List<List<String>> getStrBipartitionFromBranch(TreeBranch br) {
		List<String> right = getLabelsBelow(br);
		ArrayList<String> left = new ArrayList<String>(leafLabels);
		left.removeAll(right);
		ArrayList<List<String>> out = new ArrayList<List<String>>();
		out.add(left);
		out.add(right);
		return out;
	}

	/**
	 * @return the first branch, in branch order, that splits the leaves into the two given sides, or null
	 */
	public TreeBranch getBranchFromStrBipartition(List<String> left, List<String> right) {
		ArrayList<String> l = new ArrayList<String>(left);
		ArrayList<String> r = new ArrayList<String>(right);
		Collections.sort(l);
		Collections.sort(r);
		for (TreeBranch br : branches) {
			List<String> below = getLabelsBelow(br);
			if (below.equals(l) || below.equals(r)) {
				return br;
			}
		}
		return null;
	}

	/**
	 * @return the branch of this topology making the same split as the given bipartition, or null
	 */
	public TreeBranch getBranchFromBipartition(Bipartition bi) {
		return getBranchFromStrBipartition(bi.getLeft(), bi.getRight());
	}

	/**
	 * Lock the bipartition made by the given branch.
	 * @return false if that bipartition was already locked
	 */
	public boolean lockBranch(TreeBranch br) {
		checkBranch(br);
		Bipartition bi = new Bipartition(this, br);
		if (locks.contains(bi)) {
			return false;
		}
		locks.add(bi);
		return true;
	}

	public boolean isLocked(TreeBranch br) {
		checkBranch(br);
		return locks.contains(new Bipartition(this, br));
	}

	public List<Bipartition> getLocks() {
		return Collections.unmodifiableList(locks);
	}

	/*
	 * moves
	 */

	/**
	 * @throws RearrangementException if the destination is forbidden for the branch or lies across a locked
	 *		bipartition
	 */
	public void checkMove(TreeBranch br, TreeBranch destination) {
		HashSet<TreeBranch> f = checkBranch(br);
		checkBranch(destination);
		if (f.contains(destination)) {
			throw new RearrangementException("destination is forbidden for this branch");
		}
		if (!getPartition(br).contains(destination)) {
			throw new RearrangementException("cannot move outside of locked partition");
		}
	}

	public Rearrangement spr(TreeBranch br, TreeBranch destination) {
		checkMove(br, destination);
		return new Rearrangement(this, br, destination, RearrangementType.SPR);
	}

	/**
	 * @throws RearrangementException if the destination is not one of the branch's nearest neighbor moves
	 */
	public Rearrangement nni(TreeBranch br, TreeBranch destination) {
		checkMove(br, destination);
		if (!nniCandidates(br).contains(destination)) {
			throw new RearrangementException("destination is not a nearest neighbor interchange for this branch");
		}
		return new Rearrangement(this, br, destination, RearrangementType.NNI);
	}

	/**
	 * Prune the subtree under the given branch and regraft it onto the middle of the destination branch.
	 * @return a new topology in canonical form; this one is unchanged
	 */
	public Topology move(TreeBranch br, TreeBranch destination) {
		return readGenerated(moveToNewick(br, destination));
	}

	/**
	 * Like {@link #move(TreeBranch, TreeBranch)}, but only writes the result. The string is rooted as this topology is
	 * and is not canonical.
	 */
	public String moveToNewick(TreeBranch br, TreeBranch destination) {
		return withMove(br, destination, new MovedTreeReader<String>() {
			@Override
			public String read(TreeNode movedRoot) {
				return TreeUtils.toNewick(movedRoot, true);
			}
		});
	}

	/**
	 * Apply a checked move, hand the moved tree to the reader, and put the tree back however the reader exits.
	 */
	private <T> T withMove(TreeBranch br, TreeBranch destination, MovedTreeReader<T> reader) {
		checkMove(br, destination);
		try (AppliedMove applied = new AppliedMove(br, destination)) {
			return reader.read(root);
		}
	}

	private interface MovedTreeReader<T> {
		T read(TreeNode movedRoot);
	}

	/*
	 * a move applied in place to this topology's nodes. everything touched is recorded so close() can restore the
	 * exact child order and parent references.
	 */
	private class AppliedMove implements AutoCloseable {

		private TreeBranch branch;
		private TreeBranch destination;
		private TreeNode sParent;
		private TreeNode tParent;
		private TreeNode destChild;
		private int sIndex;
		private int tIndex;

		// set only when the vacated node had to be smoothed
		private TreeBranch upper;
		private TreeBranch lower;
		private TreeNode mergeTop;
		private int mIndex;

		AppliedMove(TreeBranch branch, TreeBranch destination) {
			this.branch = branch;
			this.destination = destination;
			sParent = branch.getParent();
			tParent = destination.getParent();
			destChild = destination.getChild();

			// prune
			sIndex = sParent.getChildren().indexOf(branch);
			sParent.getChildren().remove(sIndex);

			// regraft onto the middle of the destination
			TreeNode node = new TreeNode();
			double half = destination.getLength() / 2;
			TreeBranch outer = new TreeBranch(destChild, half, node);
			TreeBranch inner = new TreeBranch(node, half, tParent);
			tIndex = tParent.getChildren().indexOf(destination);
			tParent.getChildren().set(tIndex, inner);
			node.getChildren().add(branch);
			node.getChildren().add(outer);
			branch.setParent(node);
			destChild.setParent(outer);
			node.setParent(inner);

			// smooth the node the subtree left
			if (sParent.getChildCount() == 1 && sParent.getParent() != null) {
				lower = sParent.getChild(0);
				upper = sParent.getParent();
				mergeTop = upper.getParent();
				TreeNode end = lower.getChild();
				TreeBranch merged = new TreeBranch(end, upper.getLength() + lower.getLength(), mergeTop);
				end.setParent(merged);
				mIndex = mergeTop.getChildren().indexOf(upper);
				mergeTop.getChildren().set(mIndex, merged);
			}
		}

		@Override
		public void close() {
			if (upper != null) {
				mergeTop.getChildren().set(mIndex, upper);
				lower.getChild().setParent(lower);
			}
			tParent.getChildren().set(tIndex, destination);
			destChild.setParent(destination);
			sParent.getChildren().add(sIndex, branch);
			branch.setParent(sParent);
		}
	}

	/*
	 * enumeration
	 */

	// the branch above the grandparent node and the siblings of the parent branch
	private List<TreeBranch> nniCandidates(TreeBranch br) {
		ArrayList<TreeBranch> out = new ArrayList<TreeBranch>();
		TreeBranch up = br.getParent().getParent();
		if (up == null) {
			return out;
		}
		TreeNode grandparent = up.getParent();
		if (grandparent.getParent() != null) {
			out.add(grandparent.getParent());
		}
		for (TreeBranch sib : grandparent.getChildren()) {
			if (sib != up) {
				out.add(sib);
			}
		}
		return out;
	}

	public List<Rearrangement> allSPRForBranch(TreeBranch br) {
		return allSPRForBranch(br, true);
	}

	/**
	 * @param flip if true, also include the moves of the other side of the branch's bipartition, found by rerooting
	 *		a copy of this topology inside the subtree under the branch. Those moves belong to the copy.
	 */
	public List<Rearrangement> allSPRForBranch(TreeBranch br, boolean flip) {
		HashSet<TreeBranch> f = checkBranch(br);
		ArrayList<Rearrangement> moves = new ArrayList<Rearrangement>();
		for (TreeBranch dest : getPartition(br)) {
			if (!f.contains(dest)) {
				moves.add(new Rearrangement(this, br, dest, RearrangementType.SPR));
			}
		}
		if (flip) {
			Topology other = flipFor(br);
			if (other != null) {
				TreeBranch ob = other.getBranchFromBipartition(new Bipartition(this, br));
				if (ob != null) {
					moves.addAll(other.allSPRForBranch(ob, false));
				}
			}
		}
		return moves;
	}

	public List<Rearrangement> allNNIForBranch(TreeBranch br) {
		return allNNIForBranch(br, true);
	}

	/**
	 * @param flip see {@link #allSPRForBranch(TreeBranch, boolean)}
	 */
	public List<Rearrangement> allNNIForBranch(TreeBranch br, boolean flip) {
		HashSet<TreeBranch> f = checkBranch(br);
		ArrayList<Rearrangement> moves = new ArrayList<Rearrangement>();
		Set<TreeBranch> partition = getPartition(br);
		for (TreeBranch dest : nniCandidates(br)) {
			if (partition.contains(dest) && !f.contains(dest)) {
				moves.add(new Rearrangement(this, br, dest, RearrangementType.NNI));
			}
		}
		if (flip) {
			Topology other = flipFor(br);
			if (other != null) {
				TreeBranch ob = other.getBranchFromBipartition(new Bipartition(this, br));
				if (ob != null) {
					moves.addAll(other.allNNIForBranch(ob, false));
				}
			}
		}
		return moves;
	}

	public List<Rearrangement> allTypeForBranch(TreeBranch br, RearrangementType type) {
		if (type == RearrangementType.SPR) {
			return allSPRForBranch(br);
		} else if (type == RearrangementType.NNI) {
			return allNNIForBranch(br);
		}
		throw new RearrangementException("no enumeration of " + type.getName() + " rearrangements");
	}

	public List<Rearrangement> allSPR() {
		return allType(RearrangementType.SPR);
	}

	public List<Rearrangement> allNNI() {
		return allType(RearrangementType.NNI);
	}

	/**
	 * @return every legal move of the given type, over all branches
	 * @throws RearrangementException for a type that cannot be enumerated
	 */
	public List<Rearrangement> allType(RearrangementType type) {
		ArrayList<Rearrangement> moves = new ArrayList<Rearrangement>();
		for (TreeBranch br : branches) {
			moves.addAll(allTypeForBranch(br, type));
		}
		if (_LOG.isDebugEnabled()) {
			_LOG.debug(moves.size() + " " + type.getName() + " moves for " + toStructure());
		}
		return moves;
	}

	/*
	 * a copy of this topology rooted at a leaf under the given branch, carrying every lock but the anchor's. null if
	 * there is no such leaf.
	 */
	private Topology flipFor(TreeBranch br) {
		String newAnchor = null;
		for (String l : getLabelsBelow(br)) {
			if (!l.equals(getAnchorLabel())) {
				newAnchor = l;
				break;
			}
		}
		if (newAnchor == null) {
			return null;
		}
		Topology dup;
		try {
			dup = fromNewick(toNewick(), newAnchor);
		} catch (TreeParseException tpe) {
			throw new IllegalStateException("could not read back a generated tree", tpe);
		}
		for (Bipartition lock : locks) {
			if (lock.getBranch() == anchor) {
				continue;
			}
			TreeBranch b = dup.getBranchFromBipartition(lock);
			if (b != null) {
				dup.lockBranch(b);
			}
		}
		return dup;
	}

	/*
	 * output
	 */

	/**
	 * @return the canonical newick string with branch lengths
	 */
	public String toNewick() {
		return TreeUtils.toNewick(root, true);
	}

	/**
	 * @return the canonical newick string without branch lengths, which identifies the topology
	 */
	public String toStructure() {
		return TreeUtils.toNewick(root, false);
	}

	/**
	 * @return the newick string with the anchor leaf joined to the top-level children, giving an unrooted
	 *		multifurcation at the top
	 */
	public String toUnrootedNewick() {
		TreeNode top = fake.getChild();
		if (top.isExternal()) {
			return toNewick();
		}
		ArrayList<TreeBranch> joined = new ArrayList<TreeBranch>();
		joined.add(new TreeBranch(anchor.getChild(), anchor.getLength() + fake.getLength(), null));
		joined.addAll(top.getChildren());
		return TreeUtils.toNewick(joined, true);
	}

	public PhyloTree toTree() {
		try {
			return new PhyloTree(toNewick(), false);
		} catch (TreeParseException tpe) {
			throw new IllegalStateException("could not read back a generated tree", tpe);
		}
	}

	public PhyloTree toUnrootedTree() {
		try {
			return new PhyloTree(toUnrootedNewick(), false);
		} catch (TreeParseException tpe) {
			throw new IllegalStateException("could not read back a generated tree", tpe);
		}
	}

	static Topology readGenerated(String newick) {
		try {
			return fromNewick(newick);
		} catch (TreeParseException tpe) {
			throw new IllegalStateException("could not read back a generated tree: " + newick, tpe);
		}
	}

	@Override
	public String toString() {
		return toNewick();
	}
}
