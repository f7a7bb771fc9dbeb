package treespace.landscape;

import java.util.HashMap;

import treespace.exceptions.ScoringException;
import treespace.scoring.Alignment;
import treespace.scoring.TreeScorer;

/**
 * Scorer for tests: a parsimony of 1.0 for every tree, and likelihoods only for the structures it is given.
 */
public class StubScorer implements TreeScorer {

	public HashMap<String, Double> likelihoods = new HashMap<String, Double>();
	public int parsimonyCalls = 0;
	public int likelihoodCalls = 0;
	public boolean failing = false;

	@Override
	public Double getParsimony(String newick, Alignment alignment) throws ScoringException {
		parsimonyCalls++;
		if (failing) {
			throw new ScoringException("scorer is down");
		}
		return 1.0;
	}

	@Override
	public Double getLogLikelihood(String newick, Alignment alignment) throws ScoringException {
		likelihoodCalls++;
		if (failing) {
			throw new ScoringException("scorer is down");
		}
		return likelihoods.get(newick);
	}
}
