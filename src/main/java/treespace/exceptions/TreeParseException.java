package treespace.exceptions;

import java.io.PrintStream;

/**
 * Thrown when a newick string cannot be read: a missing terminating semicolon, unbalanced parentheses, or a branch
 * length that is not a non-negative real number.
 */
public class TreeParseException extends Exception {

	private static final long serialVersionUID = 1L;
	private String msg;
	private int position;

	public TreeParseException(String msg) {
		this(msg, -1);
	}

	public TreeParseException(String msg, int position) {
		super(msg);
		this.msg = msg;
		this.position = position;
	}

	/**
	 * @return the index in the input string where reading failed, or -1 if the error is not tied to a position
	 */
	public int getPosition() {
		return position;
	}

	@Override
	public String toString() {
		if (position < 0) {
			return "Newick not recognized: " + msg;
		}
		return "Newick not recognized at position " + position + ": " + msg;
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		String em = failedAction + " failed. " + this.toString();
		out.println(em);
	}
}
