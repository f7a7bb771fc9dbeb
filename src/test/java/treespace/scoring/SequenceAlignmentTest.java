package treespace.scoring;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.LinkedHashMap;

import org.junit.Test;

public class SequenceAlignmentTest {

	@Test
	public void keepsTaxonOrder() {
		LinkedHashMap<String, String> seqs = new LinkedHashMap<String, String>();
		seqs.put("C", "AC");
		seqs.put("A", "AG");
		seqs.put("B", "TT");
		SequenceAlignment aln = new SequenceAlignment(seqs);
		assertEquals(Arrays.asList("C", "A", "B"), aln.getTaxa());
		assertEquals(3, aln.getNumTaxa());
		assertEquals(2, aln.getLength());
		assertEquals("AG", aln.getSequence("A"));
		assertEquals("((A,B),C);", aln.getInitialTree());
	}

	@Test
	public void givenInitialTree() {
		LinkedHashMap<String, String> seqs = new LinkedHashMap<String, String>();
		seqs.put("A", "A");
		seqs.put("B", "A");
		seqs.put("C", "A");
		assertEquals("(A,B,C);", new SequenceAlignment(seqs, "(A,B,C);").getInitialTree());
	}

	@Test(expected = IllegalArgumentException.class)
	public void unequalLengths() {
		LinkedHashMap<String, String> seqs = new LinkedHashMap<String, String>();
		seqs.put("A", "ACGT");
		seqs.put("B", "ACG");
		new SequenceAlignment(seqs);
	}
}
