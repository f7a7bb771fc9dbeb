package treespace.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * A node of a parsed tree. Leaves carry a taxon label and have no children. Internal nodes may carry a label
 * (often a support value) which is cleared when the tree is turned into a topology; the cleared label can still be
 * recovered through {@link #getStoredLabel()}.
 */
public class TreeNode {

	private String label;
	private String storedLabel;
	private TreeBranch parent;
	private ArrayList<TreeBranch> children;

	/*
	 * constructors
	 */
	public TreeNode() {
		this("");
	}

	public TreeNode(String label) {
		this.label = label == null ? "" : label;
		this.storedLabel = this.label;
		this.parent = null;
		this.children = new ArrayList<TreeBranch>();
	}

	public TreeNode(String label, List<TreeBranch> children) {
		this(label);
		for (TreeBranch b : children) {
			addChild(b);
		}
	}

	/*
	 * public methods
	 */

	public List<TreeBranch> getChildren() {return this.children;}

	public int getChildCount() {return this.children.size();}

	/**
	 * @return the c-th child branch or throw IndexOutOfBoundsException.
	 */
	public TreeBranch getChild(int c) throws IndexOutOfBoundsException {
		return this.children.get(c);
	}

	public boolean isExternal() {return (this.children.size() < 1);}

	public boolean isInternal() {return (this.children.size() > 0);}

	public boolean isTheRoot() {return (this.parent == null);}

	public boolean hasParent() {return (this.parent != null);}

	/**
	 * @return the branch leading to this node, or null for the root
	 */
	public TreeBranch getParent() {return this.parent;}

	public void setParent(TreeBranch p) {this.parent = p;}

	public String getLabel() {return this.label;}

	public void setLabel(String s) {
		this.label = s == null ? "" : s;
		this.storedLabel = this.label;
	}

	/**
	 * Blank the visible label, keeping the old value available from {@link #getStoredLabel()}.
	 */
	public void clearLabel() {
		this.storedLabel = this.label;
		this.label = "";
	}

	public String getStoredLabel() {return this.storedLabel;}

	public boolean hasChild(TreeBranch test) {return this.children.contains(test);}

	/**
	 * Append a child branch and point its parent reference at this node.
	 * @return false if the branch was already a child
	 */
	public boolean addChild(TreeBranch c) {
		if (this.hasChild(c) == false) {
			this.children.add(c);
			c.setParent(this);
			return true;
		} else {
			return false;
		}
	}

	public boolean removeChild(TreeBranch c) {
		return this.children.remove(c);
	}

	/**
	 * @param bl should be true to include branch lengths
	 * @return canonical newick representation of the subtree rooted at this node, without the trailing semicolon
	 */
	public String getNewick(boolean bl) {
		return TreeUtils.writeSubtree(this, bl);
	}

	@Override
	public String toString() {
		return getNewick(true);
	}
}
