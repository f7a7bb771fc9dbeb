package treespace.tree;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import treespace.exceptions.TreeParseException;

public class PhyloTreeSetTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void keepsOrder() throws TreeParseException {
		PhyloTreeSet ts = new PhyloTreeSet();
		PhyloTree a = new PhyloTree("((A,B),(C,D));");
		PhyloTree b = new PhyloTree("((A,C),(B,D));");
		ts.addTree(a);
		ts.addTree(b);
		assertEquals(2, ts.size());
		assertEquals(1, ts.indexOf(b));
		assertSame(a, ts.getTree(0));
		assertTrue(ts.removeTree(a));
		assertEquals(0, ts.indexOf(b));
		assertEquals(-1, ts.indexOf(a));
	}

	@Test
	public void writesAndReadsTreeFile() throws TreeParseException, IOException {
		PhyloTreeSet ts = new PhyloTreeSet();
		ts.addTree(new PhyloTree("((A,B),(C,D));"));
		ts.addTree(new PhyloTree("((A:1,D:2),(B,C));"));
		File f = folder.newFile("trees.tre");
		ts.toTreeFile(f);
		assertEquals(2, FileUtils.readLines(f, "UTF-8").size());

		PhyloTreeSet back = PhyloTreeSet.fromTreeFile(f);
		assertEquals(2, back.size());
		for (int i = 0; i < ts.size(); i++) {
			assertEquals(ts.getTree(i).getStructure(), back.getTree(i).getStructure());
			assertEquals(ts.getTree(i).getNewick(), back.getTree(i).getNewick());
		}
	}

	@Test
	public void skipsBlankLines() throws TreeParseException, IOException {
		File f = folder.newFile("blank.tre");
		FileUtils.writeStringToFile(f, "(A,(B,C));\n\n   \n(B,(A,C));\n", "UTF-8");
		assertEquals(2, PhyloTreeSet.fromTreeFile(f).size());
	}
}
