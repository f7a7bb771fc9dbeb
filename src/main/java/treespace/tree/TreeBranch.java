package treespace.tree;

/**
 * An edge of a parsed tree. A branch owns the node below it and knows the node above it. Removing a branch splits
 * the leaves into the two sides of a bipartition.
 */
public class TreeBranch {

	private TreeNode child;
	private TreeNode parent;
	private double length; // 0.0 means no length was given

	public TreeBranch(TreeNode child) {
		this(child, 0.0, null);
	}

	/**
	 * Does not touch the parent references of the nodes; use {@link TreeNode#addChild(TreeBranch)} or
	 * {@link TreeUtils#assignParents(TreeNode)} for that.
	 */
	public TreeBranch(TreeNode child, double length, TreeNode parent) {
		this.child = child;
		this.length = length;
		this.parent = parent;
	}

	public TreeNode getChild() {return this.child;}

	public void setChild(TreeNode c) {this.child = c;}

	public TreeNode getParent() {return this.parent;}

	public void setParent(TreeNode p) {this.parent = p;}

	public double getLength() {return this.length;}

	public void setLength(double l) {this.length = l;}

	public boolean hasLength() {return this.length > 0;}

	@Override
	public String toString() {
		return TreeUtils.writeBranch(this, true);
	}
}
