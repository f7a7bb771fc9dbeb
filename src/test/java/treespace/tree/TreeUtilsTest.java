package treespace.tree;

import static org.junit.Assert.*;

import java.math.BigInteger;
import java.util.List;

import org.junit.Test;

import treespace.exceptions.TreeParseException;

public class TreeUtilsTest {

	private static TreeNode read(String s) throws TreeParseException {
		return new TreeReader().readTree(s);
	}

	@Test
	public void countsTopologies() {
		assertEquals(BigInteger.ONE, TreeUtils.numberUnrootedTrees(3));
		assertEquals(BigInteger.valueOf(3), TreeUtils.numberUnrootedTrees(4));
		assertEquals(BigInteger.valueOf(15), TreeUtils.numberUnrootedTrees(5));
		assertEquals(BigInteger.valueOf(2027025), TreeUtils.numberUnrootedTrees(10));
		assertEquals(BigInteger.valueOf(15), TreeUtils.numberRootedTrees(4));
	}

	@Test(expected = IllegalArgumentException.class)
	public void negativeTaxonCount() {
		TreeUtils.numberUnrootedTrees(-1);
	}

	@Test
	public void traversals() throws TreeParseException {
		TreeNode root = read("((A,B),C);");
		List<TreeNode> post = TreeUtils.postOrderTraversal(root);
		assertEquals(5, post.size());
		assertSame(root, post.get(4));
		assertEquals("A", post.get(0).getLabel());
		assertEquals(3, TreeUtils.getAllLeaves(root).size());
		assertEquals(4, TreeUtils.getAllBranches(root).size());
		assertEquals(2, TreeUtils.getAllBranches(root.getChild(0)).size());
	}

	@Test
	public void siblings() throws TreeParseException {
		TreeNode root = read("((A,B),C);");
		TreeNode ab = root.getChild(0).getChild();
		assertTrue(TreeUtils.isSibling(ab.getChild(0), ab.getChild(1)));
		assertFalse(TreeUtils.isSibling(ab.getChild(0), root.getChild(1)));
		assertFalse(TreeUtils.isSibling(ab.getChild(0), ab.getChild(0)));
	}

	@Test
	public void smoothsUnaryNodes() throws TreeParseException {
		TreeNode root = read("((A:1):2,B);");
		TreeUtils.removeUnaryInternalNodes(root);
		assertEquals("(A:3.0,B);", TreeUtils.toNewick(root, true));
		assertSame(root, root.getChild(0).getParent());
	}

	@Test
	public void dropsLengths() throws TreeParseException {
		TreeNode root = read("((A:1,B:2):3,C:4);");
		TreeUtils.removeBranchLengths(root);
		assertEquals("((A,B),C);", TreeUtils.toNewick(root, true));
	}

	@Test
	public void reversesToNewRoot() throws TreeParseException {
		TreeNode root = read("((A,B)x,C);");
		TreeNode x = root.getChild(0).getChild();
		TreeUtils.reverseToRoot(x);
		assertTrue(x.isTheRoot());
		assertEquals(3, x.getChildCount());
		assertEquals("(A,B,(C));", TreeUtils.toNewick(x, false));
	}

	@Test
	public void writesChildrenInLabelOrder() throws TreeParseException {
		assertEquals("((A,B),C);", TreeUtils.toNewick(read("(C,(B,A));"), false));
		assertEquals("((A,D),(B,C));", TreeUtils.toNewick(read("((C,B),(D,A));"), false));
	}
}
