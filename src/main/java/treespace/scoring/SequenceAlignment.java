package treespace.scoring;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An alignment held in memory as an ordered map from taxon label to aligned sequence.
 */
public class SequenceAlignment implements Alignment {

	private LinkedHashMap<String, String> sequences;
	private String initialTree;

	/**
	 * The initial tree is a ladder over the taxa in sorted label order.
	 */
	public SequenceAlignment(Map<String, String> sequences) {
		this(sequences, null);
	}

	/**
	 * @param sequences taxon label to aligned sequence, iterated in the order taxa should be reported
	 * @param initialTree newick string for the starting tree, or null for a ladder tree
	 */
	public SequenceAlignment(Map<String, String> sequences, String initialTree) {
		if (sequences.isEmpty()) {
			throw new IllegalArgumentException("an alignment needs at least one sequence");
		}
		this.sequences = new LinkedHashMap<String, String>();
		int length = -1;
		for (Map.Entry<String, String> e : sequences.entrySet()) {
			if (length >= 0 && e.getValue().length() != length) {
				throw new IllegalArgumentException("sequence for " + e.getKey() + " has length " + e.getValue().length()
						+ " but the alignment has length " + length);
			}
			length = e.getValue().length();
			this.sequences.put(e.getKey(), e.getValue());
		}
		this.initialTree = initialTree == null ? ladderTree() : initialTree;
	}

	private String ladderTree() {
		ArrayList<String> taxa = new ArrayList<String>(sequences.keySet());
		Collections.sort(taxa);
		String t = taxa.get(0);
		for (int i = 1; i < taxa.size(); i++) {
			t = "(" + t + "," + taxa.get(i) + ")";
		}
		return t + ";";
	}

	@Override
	public int getNumTaxa() {
		return sequences.size();
	}

	@Override
	public List<String> getTaxa() {
		return new ArrayList<String>(sequences.keySet());
	}

	@Override
	public String getSequence(String taxon) {
		return sequences.get(taxon);
	}

	@Override
	public int getLength() {
		return sequences.values().iterator().next().length();
	}

	@Override
	public String getInitialTree() {
		return initialTree;
	}
}
