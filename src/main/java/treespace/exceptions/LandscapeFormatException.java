package treespace.exceptions;

import java.io.PrintStream;

public class LandscapeFormatException extends Exception {

	private static final long serialVersionUID = 1L;
	private String message;

	// single message constructor
	public LandscapeFormatException(String msg) {
		super(msg);
		this.message = msg;
	}

	public LandscapeFormatException(String msg, Throwable cause) {
		super(msg, cause);
		this.message = msg;
	}

	@Override
	public String toString() {
		return "Landscape format not recognized: " + this.message;
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		String em = failedAction + " failed. " + this.toString();
		out.println(em);
	}
}
