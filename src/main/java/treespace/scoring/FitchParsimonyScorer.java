package treespace.scoring;

import java.util.IdentityHashMap;
import java.util.List;

import org.apache.log4j.Logger;

import treespace.exceptions.ScoringException;
import treespace.exceptions.TreeParseException;
import treespace.tree.TreeBranch;
import treespace.tree.TreeNode;
import treespace.tree.TreeReader;
import treespace.tree.TreeUtils;

/**
 * Fitch small parsimony. Identical alignment columns are scored once and weighted. At a node with k children the
 * states shared by the most children are kept and the cost grows by k minus that count, which reduces to the usual
 * intersection/union rule for binary nodes.
 *
 * This scorer does not compute likelihoods.
 */
public class FitchParsimonyScorer implements TreeScorer {

	private static final Logger _LOG = Logger.getLogger(FitchParsimonyScorer.class);

	private Alignment profiled;
	private ParsimonyProfiles profiles;

	@Override
	public Double getParsimony(String newick, Alignment alignment) throws ScoringException {
		ParsimonyProfiles p = getProfiles(alignment);
		TreeNode root;
		try {
			root = new TreeReader().readTree(newick);
		} catch (TreeParseException tpe) {
			throw new ScoringException("could not read tree for parsimony scoring: " + tpe.getMessage(), tpe);
		}
		List<TreeNode> order = TreeUtils.postOrderTraversal(root);
		for (TreeNode n : order) {
			if (n.isExternal() && !p.hasTaxon(n.getLabel())) {
				throw new ScoringException("taxon '" + n.getLabel() + "' is not in the alignment");
			}
		}

		long total = 0;
		IdentityHashMap<TreeNode, Long> sets = new IdentityHashMap<TreeNode, Long>();
		for (int i = 0; i < p.size(); i++) {
			int cost = 0;
			for (TreeNode n : order) {
				if (n.isExternal()) {
					sets.put(n, p.getForTaxon(i, n.getLabel()));
				} else {
					cost += fitchStep(n, sets);
				}
			}
			total += (long) cost * p.weight(i);
		}
		if (_LOG.isDebugEnabled()) {
			_LOG.debug("parsimony " + total + " for " + newick);
		}
		return (double) total;
	}

	// sets the state mask of an internal node from its children and returns the cost added there
	private static int fitchStep(TreeNode n, IdentityHashMap<TreeNode, Long> sets) {
		long union = 0L;
		for (TreeBranch br : n.getChildren()) {
			union |= sets.get(br.getChild());
		}
		if (union == 0L) {
			// column made only of gaps
			sets.put(n, 0L);
			return 0;
		}
		int best = 0;
		long bestStates = 0L;
		for (int bit = 0; bit < 64; bit++) {
			long state = 1L << bit;
			if ((union & state) == 0) {
				continue;
			}
			int count = 0;
			for (TreeBranch br : n.getChildren()) {
				if ((sets.get(br.getChild()) & state) != 0) {
					count++;
				}
			}
			if (count > best) {
				best = count;
				bestStates = state;
			} else if (count == best) {
				bestStates |= state;
			}
		}
		sets.put(n, bestStates);
		return n.getChildCount() - best;
	}

	@Override
	public Double getLogLikelihood(String newick, Alignment alignment) {
		return null;
	}

	private synchronized ParsimonyProfiles getProfiles(Alignment alignment) throws ScoringException {
		if (alignment == null) {
			throw new ScoringException("parsimony scoring needs an alignment");
		}
		if (profiled != alignment) {
			try {
				profiles = new ParsimonyProfiles(alignment);
			} catch (IllegalArgumentException iae) {
				throw new ScoringException("alignment cannot be scored by parsimony: " + iae.getMessage(), iae);
			}
			profiled = alignment;
		}
		return profiles;
	}
}
