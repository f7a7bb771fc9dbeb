package treespace.tree;

import treespace.exceptions.TreeParseException;

/**
 * Reads a newick string into a tree of {@link TreeNode} and {@link TreeBranch} objects.
 *
 * Accepted input is <code>subtree ';'</code> where a subtree is either a leaf name or a parenthesized,
 * comma-separated list of subtrees followed by an optional label. Any subtree may carry a <code>:length</code>.
 * Whitespace between tokens and bracketed notes (<code>[...]</code>) are skipped. A branch without a length gets
 * 0.0. A length on the root itself is accepted and ignored.
 *
 * A reader is not thread safe, but may be reused for successive trees.
 */
public class TreeReader {

	private String pb;
	private int x;

	/*
	 * constructor
	 */
	public TreeReader() {
	}

	/**
	 * @param treeString a newick string terminated by ';'
	 * @return the root of the tree, with all parent references set
	 * @throws TreeParseException if the terminator is missing, the parentheses do not balance, or a branch length is
	 *		not a non-negative number
	 */
	public TreeNode readTree(String treeString) throws TreeParseException {
		if (treeString == null) {
			throw new TreeParseException("no tree given");
		}
		pb = treeString.trim();
		x = 0;

		if (pb.length() == 0 || pb.charAt(pb.length() - 1) != ';') {
			throw new TreeParseException("missing concluding semicolon", pb.length());
		}

		TreeNode root = readBranch().getChild();

		skipIgnorable();
		char nextChar = pb.charAt(x);
		if (nextChar == ')') {
			throw new TreeParseException("unbalanced parentheses, unexpected ')'", x);
		} else if (nextChar != ';') {
			throw new TreeParseException("unexpected character '" + nextChar + "'", x);
		}
		x++;
		skipIgnorable();
		if (x < pb.length()) {
			throw new TreeParseException("text found after the concluding semicolon", x);
		}

		TreeUtils.assignParents(root);
		return root;
	}

	/*
	 * reads one subtree and the length of the branch above it. the parent reference of the returned branch is left
	 * unset.
	 */
	private TreeBranch readBranch() throws TreeParseException {
		skipIgnorable();
		TreeNode node;
		if (pb.charAt(x) == '(') {
			int open = x;
			x++;
			node = new TreeNode();
			boolean goingChildren = true;
			while (goingChildren) {
				node.getChildren().add(readBranch());
				skipIgnorable();
				char nextChar = pb.charAt(x);
				if (nextChar == ',') {
					x++;
				} else if (nextChar == ')') {
					x++;
					goingChildren = false;
				} else if (nextChar == ';') {
					throw new TreeParseException("unbalanced parentheses, '(' is never closed", open);
				} else {
					throw new TreeParseException("expected ',' or ')' but found '" + nextChar + "'", x);
				}
			}
			node.setLabel(readLabel());
		} else {
			node = new TreeNode(readLabel());
		}

		double length = 0.0;
		skipIgnorable();
		if (pb.charAt(x) == ':') {
			x++;
			length = readLength();
		}
		return new TreeBranch(node, length, null);
	}

	private String readLabel() throws TreeParseException {
		skipIgnorable();
		int start = x;
		while (x < pb.length() && !isDelimiter(pb.charAt(x))) {
			x++;
		}
		return pb.substring(start, x).trim();
	}

	private double readLength() throws TreeParseException {
		skipIgnorable();
		int start = x;
		while (x < pb.length() && !isDelimiter(pb.charAt(x)) && !Character.isWhitespace(pb.charAt(x))) {
			x++;
		}
		String edgeL = pb.substring(start, x);
		double bl;
		try {
			bl = Double.parseDouble(edgeL);
		} catch (NumberFormatException nfe) {
			throw new TreeParseException("branch length '" + edgeL + "' is not a number", start);
		}
		if (Double.isNaN(bl) || Double.isInfinite(bl) || bl < 0) {
			throw new TreeParseException("branch length '" + edgeL + "' is not a non-negative real number", start);
		}
		return bl;
	}

	// whitespace and [notes]
	private void skipIgnorable() throws TreeParseException {
		while (x < pb.length()) {
			char nextChar = pb.charAt(x);
			if (Character.isWhitespace(nextChar)) {
				x++;
			} else if (nextChar == '[') {
				int close = pb.indexOf(']', x);
				if (close < 0) {
					throw new TreeParseException("note opened with '[' is never closed", x);
				}
				x = close + 1;
			} else {
				return;
			}
		}
	}

	private static boolean isDelimiter(char c) {
		return c == '(' || c == ')' || c == ',' || c == ':' || c == ';' || c == '[';
	}
}
