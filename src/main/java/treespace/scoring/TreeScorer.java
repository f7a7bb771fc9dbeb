package treespace.scoring;

import treespace.exceptions.ScoringException;

/**
 * A scoring backend. Implementations must not depend on the order of calls, and calling them twice for the same
 * tree must give the same answer.
 */
public interface TreeScorer {

	/**
	 * @param newick a canonical newick string
	 * @return the parsimony cost of the tree, or null if this backend does not compute parsimony
	 * @throws ScoringException if the backend failed on this tree
	 */
	public Double getParsimony(String newick, Alignment alignment) throws ScoringException;

	/**
	 * @param newick a canonical newick string
	 * @return the log-likelihood of the tree, or null if this backend does not compute likelihoods
	 * @throws ScoringException if the backend failed on this tree
	 */
	public Double getLogLikelihood(String newick, Alignment alignment) throws ScoringException;
}
