package treespace.exceptions;

/**
 * Thrown by a scoring backend that could not produce a score for a tree.
 */
public class ScoringException extends Exception {

	private static final long serialVersionUID = 1L;

	public ScoringException(String msg) {
		super(msg);
	}

	public ScoringException(String msg, Throwable cause) {
		super(msg, cause);
	}

	@Override
	public String toString() {
		return "ScoringException: " + getMessage();
	}
}
