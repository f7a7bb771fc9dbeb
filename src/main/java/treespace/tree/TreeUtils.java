package treespace.tree;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static helpers for walking, reshaping and writing trees made of {@link TreeNode} and {@link TreeBranch}.
 */
public class TreeUtils {

	/**
	 * Point the parent reference of every branch and node below the given node at its owner. The given node is left
	 * as it is.
	 */
	public static void assignParents(TreeNode node) {
		for (TreeBranch br : node.getChildren()) {
			br.setParent(node);
			br.getChild().setParent(br);
			assignParents(br.getChild());
		}
	}

	/**
	 * @return all nodes below and including the given one, children before their parents
	 */
	public static List<TreeNode> postOrderTraversal(TreeNode node) {
		ArrayList<TreeNode> out = new ArrayList<TreeNode>();
		postOrder(node, out);
		return out;
	}

	private static void postOrder(TreeNode node, List<TreeNode> out) {
		for (TreeBranch br : node.getChildren()) {
			postOrder(br.getChild(), out);
		}
		out.add(node);
	}

	/**
	 * @return the leaves below the given node in traversal order; the node itself if it is a leaf
	 */
	public static List<TreeNode> getAllLeaves(TreeNode node) {
		ArrayList<TreeNode> out = new ArrayList<TreeNode>();
		for (TreeNode n : postOrderTraversal(node)) {
			if (n.isExternal()) {
				out.add(n);
			}
		}
		return out;
	}

	/**
	 * @return the sorted labels of the leaves below the given node
	 */
	public static List<String> getLeafLabels(TreeNode node) {
		ArrayList<String> out = new ArrayList<String>();
		for (TreeNode leaf : getAllLeaves(node)) {
			out.add(leaf.getLabel());
		}
		Collections.sort(out);
		return out;
	}

	/**
	 * @return every branch in the subtree under the given branch, not including the branch itself
	 */
	public static List<TreeBranch> getAllBranches(TreeBranch br) {
		return getAllBranches(br.getChild());
	}

	/**
	 * @return every branch below the given node, each branch listed before the branches under it
	 */
	public static List<TreeBranch> getAllBranches(TreeNode node) {
		ArrayList<TreeBranch> out = new ArrayList<TreeBranch>();
		collectBranches(node, out);
		return out;
	}

	private static void collectBranches(TreeNode node, List<TreeBranch> out) {
		for (TreeBranch br : node.getChildren()) {
			out.add(br);
			collectBranches(br.getChild(), out);
		}
	}

	/**
	 * @return true if the two distinct branches hang off the same node
	 */
	public static boolean isSibling(TreeBranch b1, TreeBranch b2) {
		if (b1 == null || b2 == null || b1 == b2) {
			return false;
		}
		return b1.getParent() != null && b1.getParent() == b2.getParent();
	}

	public static void removeBranchLengths(TreeNode node) {
		for (TreeBranch br : node.getChildren()) {
			br.setLength(0.0);
			removeBranchLengths(br.getChild());
		}
	}

	/**
	 * Smooth away every non-root node that has a single child, replacing its two branches by one whose length is the
	 * sum of theirs. The replacement keeps the position of the upper branch among its siblings.
	 */
	public static void removeUnaryInternalNodes(TreeNode node) {
		for (TreeBranch br : new ArrayList<TreeBranch>(node.getChildren())) {
			removeUnaryInternalNodes(br.getChild());
		}
		if (node.getChildCount() == 1 && node.getParent() != null) {
			TreeBranch down = node.getChild(0);
			TreeBranch up = node.getParent();
			TreeNode above = up.getParent();
			TreeBranch merged = new TreeBranch(down.getChild(), up.getLength() + down.getLength(), above);
			down.getChild().setParent(merged);
			above.getChildren().set(above.getChildren().indexOf(up), merged);
		}
	}

	/**
	 * Reverse the direction of every branch on the path from the given node to the root of its tree, so that the
	 * given node becomes the root. Branch objects and their lengths are kept; only their orientation changes.
	 */
	public static void reverseToRoot(TreeNode node) {
		TreeBranch up = node.getParent();
		if (up == null) {
			return;
		}
		TreeNode parent = up.getParent();
		reverseToRoot(parent);
		parent.removeChild(up);
		up.setChild(parent);
		up.setParent(node);
		node.getChildren().add(up);
		parent.setParent(up);
		node.setParent(null);
	}

	/**
	 * @return the number of distinct unrooted binary topologies on the given number of taxa, (2t-5)!!
	 */
	public static BigInteger numberUnrootedTrees(int t) {
		if (t < 0) {
			throw new IllegalArgumentException("number of taxa cannot be negative: " + t);
		}
		BigInteger n = BigInteger.ONE;
		for (int k = 3; k <= 2 * t - 5; k += 2) {
			n = n.multiply(BigInteger.valueOf(k));
		}
		return n;
	}

	/**
	 * @return the number of distinct rooted binary topologies on the given number of taxa
	 */
	public static BigInteger numberRootedTrees(int t) {
		return numberUnrootedTrees(t + 1);
	}

	/*
	 * newick writing. children are written in the order of the smallest leaf label found below them, which makes the
	 * output independent of the order the children were read or built in.
	 */

	/**
	 * @return the newick string, with the trailing semicolon, of the tree rooted at the given node
	 */
	public static String toNewick(TreeNode root, boolean bl) {
		return writeSubtree(root, bl) + ";";
	}

	/**
	 * @return the newick string, with the trailing semicolon, of a tree whose top level is made of the given
	 *		branches. The parent references of the branches are not consulted.
	 */
	public static String toNewick(List<TreeBranch> topLevel, boolean bl) {
		Map<TreeNode, String> minLabels = new IdentityHashMap<TreeNode, String>();
		StringBuffer sb = new StringBuffer();
		writeChildren(topLevel, bl, minLabels, sb);
		return sb.append(";").toString();
	}

	static String writeSubtree(TreeNode node, boolean bl) {
		StringBuffer sb = new StringBuffer();
		writeNode(node, bl, new IdentityHashMap<TreeNode, String>(), sb);
		return sb.toString();
	}

	static String writeBranch(TreeBranch br, boolean bl) {
		StringBuffer sb = new StringBuffer();
		writeNode(br.getChild(), bl, new IdentityHashMap<TreeNode, String>(), sb);
		if (bl && br.hasLength()) {
			sb.append(":").append(br.getLength());
		}
		return sb.toString();
	}

	private static void writeNode(TreeNode node, boolean bl, Map<TreeNode, String> minLabels, StringBuffer sb) {
		if (node.isInternal()) {
			writeChildren(node.getChildren(), bl, minLabels, sb);
		}
		sb.append(node.getLabel());
	}

	private static void writeChildren(List<TreeBranch> children, boolean bl, final Map<TreeNode, String> minLabels,
			StringBuffer sb) {
		ArrayList<TreeBranch> ordered = new ArrayList<TreeBranch>(children);
		Collections.sort(ordered, new Comparator<TreeBranch>() {
			@Override
			public int compare(TreeBranch a, TreeBranch b) {
				return minLeafLabel(a.getChild(), minLabels).compareTo(minLeafLabel(b.getChild(), minLabels));
			}
		});
		sb.append("(");
		for (int i = 0; i < ordered.size(); i++) {
			if (i > 0) {
				sb.append(",");
			}
			TreeBranch br = ordered.get(i);
			writeNode(br.getChild(), bl, minLabels, sb);
			if (bl && br.hasLength()) {
				sb.append(":").append(br.getLength());
			}
		}
		sb.append(")");
	}

	private static String minLeafLabel(TreeNode node, Map<TreeNode, String> minLabels) {
		String m = minLabels.get(node);
		if (m == null) {
			if (node.isExternal()) {
				m = node.getLabel();
			} else {
				for (TreeBranch br : node.getChildren()) {
					String c = minLeafLabel(br.getChild(), minLabels);
					if (m == null || c.compareTo(m) < 0) {
						m = c;
					}
				}
			}
			minLabels.put(node, m);
		}
		return m;
	}
}
