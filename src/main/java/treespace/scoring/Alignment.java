package treespace.scoring;

import java.util.List;

/**
 * The sequence data a landscape is scored against.
 */
public interface Alignment {

	public int getNumTaxa();

	/**
	 * @return the taxon labels, in the same order on every call
	 */
	public List<String> getTaxa();

	/**
	 * @return the aligned sequence of the given taxon, or null if the taxon is not in the alignment
	 */
	public String getSequence(String taxon);

	/**
	 * @return the number of aligned columns
	 */
	public int getLength();

	/**
	 * @return a newick string over all taxa, used as the starting point of a landscape
	 */
	public String getInitialTree();
}
