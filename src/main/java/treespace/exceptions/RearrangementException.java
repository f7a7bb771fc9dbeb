package treespace.exceptions;

import java.io.PrintStream;

/**
 * Thrown when an illegal rearrangement is requested: the destination is forbidden for the moving branch, lies
 * across a locked bipartition, or the operator type is not supported.
 */
public class RearrangementException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private String msg;

	public RearrangementException(String msg) {
		super(msg);
		this.msg = msg;
	}

	public String getError() {
		return msg;
	}

	@Override
	public String toString() {
		return "RearrangementException: " + msg;
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		String em = failedAction + " failed. " + this.toString();
		out.println(em);
	}
}
