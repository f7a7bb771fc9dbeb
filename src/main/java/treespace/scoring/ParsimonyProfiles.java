package treespace.scoring;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * The distinct columns (site patterns) of an alignment, each with the number of columns it stands for. Every
 * character is given a bit in a state mask; gaps and '?' match every state.
 */
public class ParsimonyProfiles {

	private List<String> taxa;
	private HashMap<String, Integer> taxonIndex;
	private ArrayList<long[]> patterns; // per pattern, per taxon: state mask
	private ArrayList<Integer> weights;
	private int numSites;

	public ParsimonyProfiles(Alignment alignment) {
		taxa = alignment.getTaxa();
		taxonIndex = new HashMap<String, Integer>();
		for (int t = 0; t < taxa.size(); t++) {
			taxonIndex.put(taxa.get(t), t);
		}
		numSites = alignment.getLength();

		// assign each concrete character a bit
		HashMap<Character, Long> stateBits = new HashMap<Character, Long>();
		for (String taxon : taxa) {
			String seq = alignment.getSequence(taxon);
			for (int s = 0; s < seq.length(); s++) {
				char c = Character.toUpperCase(seq.charAt(s));
				if (!isWildcard(c) && !stateBits.containsKey(c)) {
					if (stateBits.size() == 63) {
						throw new IllegalArgumentException("too many character states in alignment");
					}
					stateBits.put(c, 1L << stateBits.size());
				}
			}
		}
		long all = 0L;
		for (long b : stateBits.values()) {
			all |= b;
		}

		LinkedHashMap<String, Integer> seen = new LinkedHashMap<String, Integer>();
		patterns = new ArrayList<long[]>();
		weights = new ArrayList<Integer>();
		for (int s = 0; s < numSites; s++) {
			StringBuffer column = new StringBuffer();
			long[] masks = new long[taxa.size()];
			for (int t = 0; t < taxa.size(); t++) {
				char c = Character.toUpperCase(alignment.getSequence(taxa.get(t)).charAt(s));
				column.append(c);
				masks[t] = isWildcard(c) ? all : stateBits.get(c);
			}
			String key = column.toString();
			Integer at = seen.get(key);
			if (at == null) {
				seen.put(key, patterns.size());
				patterns.add(masks);
				weights.add(1);
			} else {
				weights.set(at, weights.get(at) + 1);
			}
		}
	}

	private static boolean isWildcard(char c) {
		return c == '-' || c == '?';
	}

	public int size() {
		return patterns.size();
	}

	public int getNumSites() {
		return numSites;
	}

	public int weight(int pattern) {
		return weights.get(pattern);
	}

	/**
	 * @return the state mask of the taxon in the given pattern, or null for an unknown taxon
	 */
	public Long getForTaxon(int pattern, String taxon) {
		Integer t = taxonIndex.get(taxon);
		if (t == null) {
			return null;
		}
		return patterns.get(pattern)[t];
	}

	public boolean hasTaxon(String taxon) {
		return taxonIndex.containsKey(taxon);
	}
}
