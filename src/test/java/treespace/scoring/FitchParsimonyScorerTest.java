package treespace.scoring;

import static org.junit.Assert.*;

import java.util.LinkedHashMap;

import org.junit.Before;
import org.junit.Test;

import treespace.exceptions.ScoringException;

public class FitchParsimonyScorerTest {

	protected FitchParsimonyScorer scorer;

	@Before
	public void prepareScorer() {
		scorer = new FitchParsimonyScorer();
	}

	private static Alignment alignment(String... taxonThenSequence) {
		LinkedHashMap<String, String> seqs = new LinkedHashMap<String, String>();
		for (int i = 0; i < taxonThenSequence.length; i += 2) {
			seqs.put(taxonThenSequence[i], taxonThenSequence[i + 1]);
		}
		return new SequenceAlignment(seqs);
	}

	@Test
	public void countsChanges() throws ScoringException {
		Alignment aln = alignment("A", "AAG", "B", "AAG", "C", "CCG", "D", "CCT");
		assertEquals(3.0, scorer.getParsimony("((A,B),(C,D));", aln), 0.0);
		assertEquals(5.0, scorer.getParsimony("((A,C),(B,D));", aln), 0.0);
		assertEquals(3.0, scorer.getParsimony("(A:0.1,(B:2,(C,D):1));", aln), 0.0);
	}

	@Test
	public void mergesIdenticalColumns() {
		ParsimonyProfiles p = new ParsimonyProfiles(alignment("A", "AAG", "B", "AAG", "C", "CCG", "D", "CCT"));
		assertEquals(2, p.size());
		assertEquals(3, p.getNumSites());
		assertEquals(2, p.weight(0));
		assertEquals(1, p.weight(1));
		assertTrue(p.hasTaxon("D"));
		assertNull(p.getForTaxon(0, "X"));
	}

	@Test
	public void gapsMatchAnything() throws ScoringException {
		Alignment aln = alignment("A", "-", "B", "A", "C", "C", "D", "C");
		assertEquals(1.0, scorer.getParsimony("((A,B),(C,D));", aln), 0.0);
		assertEquals(0.0, scorer.getParsimony("((A,C),(B,D));", alignment("A", "?", "B", "-", "C", "-", "D", "?")), 0.0);
	}

	@Test
	public void scoresMultifurcations() throws ScoringException {
		assertEquals(1.0, scorer.getParsimony("(A,B,C);", alignment("A", "A", "B", "A", "C", "C")), 0.0);
		assertEquals(2.0, scorer.getParsimony("(A,B,C);", alignment("A", "A", "B", "G", "C", "C")), 0.0);
	}

	@Test(expected = ScoringException.class)
	public void unknownTaxon() throws ScoringException {
		scorer.getParsimony("((A,B),(C,X));", alignment("A", "A", "B", "A", "C", "C", "D", "C"));
	}

	@Test(expected = ScoringException.class)
	public void tooManyStates() throws ScoringException {
		StringBuilder seq = new StringBuilder();
		for (int i = 0; i < 64; i++) {
			seq.append((char) (0x4E00 + i));
		}
		Alignment aln = alignment("A", seq.toString(), "B", seq.toString(), "C", seq.toString());
		scorer.getParsimony("(A,(B,C));", aln);
	}

	@Test(expected = ScoringException.class)
	public void needsAlignment() throws ScoringException {
		scorer.getParsimony("((A,B),(C,D));", null);
	}

	@Test
	public void noLikelihood() throws ScoringException {
		assertNull(scorer.getLogLikelihood("((A,B),(C,D));", alignment("A", "A", "B", "A", "C", "C", "D", "C")));
	}
}
