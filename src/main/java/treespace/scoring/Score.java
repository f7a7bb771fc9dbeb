package treespace.scoring;

/**
 * The pair of fitness values attached to a tree. Either value may be null when it has not been computed.
 */
public class Score {

	public static final Score UNSCORED = new Score(null, null);

	private final Double likelihood;
	private final Double parsimony;

	public Score(Double likelihood, Double parsimony) {
		this.likelihood = likelihood;
		this.parsimony = parsimony;
	}

	/**
	 * @return the log-likelihood, or null
	 */
	public Double getLikelihood() {
		return likelihood;
	}

	/**
	 * @return the parsimony cost, or null
	 */
	public Double getParsimony() {
		return parsimony;
	}

	public boolean hasLikelihood() {
		return likelihood != null;
	}

	public boolean hasParsimony() {
		return parsimony != null;
	}

	public Score withLikelihood(Double l) {
		return new Score(l, parsimony);
	}

	public Score withParsimony(Double p) {
		return new Score(likelihood, p);
	}

	@Override
	public String toString() {
		return "(" + likelihood + ", " + parsimony + ")";
	}
}
