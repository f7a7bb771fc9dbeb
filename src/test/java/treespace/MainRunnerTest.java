package treespace;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import treespace.io.LandscapeReader;
import treespace.landscape.Landscape;

public class MainRunnerTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	protected ByteArrayOutputStream buffer;
	protected PrintStream out;

	@Before
	public void prepareOutput() {
		buffer = new ByteArrayOutputStream();
		out = new PrintStream(buffer, true);
	}

	private String[] lines() {
		return buffer.toString().trim().split("\\r?\\n");
	}

	@Test
	public void count() {
		assertEquals(0, MainRunner.run(new String[] {"count", "5"}, out));
		assertEquals("15", buffer.toString().trim());
	}

	@Test
	public void reroot() {
		assertEquals(0, MainRunner.run(new String[] {"reroot", "(((A,B),C),(D,E));"}, out));
		assertEquals("(A,(B,(C,(D,E))));", buffer.toString().trim());
	}

	@Test
	public void neighbors() {
		assertEquals(0, MainRunner.run(new String[] {"neighbors", "(((A,B),C),(D,E));"}, out));
		assertEquals(12, lines().length);
		buffer.reset();
		assertEquals(0, MainRunner.run(new String[] {"neighbors", "(((A,B),C),(D,E));", "NNI"}, out));
		assertEquals(4, lines().length);
	}

	@Test
	public void explore() throws Exception {
		File f = new File(folder.getRoot(), "landscape.json");
		assertEquals(0, MainRunner.run(new String[] {"explore", "(((A,B),C),(D,E));", "SPR", "5", f.getPath()}, out));
		Landscape back = LandscapeReader.read(f, null, null);
		assertEquals(13, back.size());
		assertTrue(back.getNode(0).isExplored());
	}

	@Test
	public void failedActions() {
		assertEquals(1, MainRunner.run(new String[] {"reroot", "((A,B),C"}, out));
		assertEquals(1, MainRunner.run(new String[] {"neighbors", "((A,B),(C,D));", "TBR"}, out));
	}

	@Test
	public void usageErrors() {
		assertEquals(2, MainRunner.run(new String[] {}, out));
		assertEquals(2, MainRunner.run(new String[] {"count"}, out));
		assertEquals(2, MainRunner.run(new String[] {"count", "five"}, out));
		assertEquals(2, MainRunner.run(new String[] {"count", "99999999999"}, out));
		assertEquals(2, MainRunner.run(new String[] {"neighbors", "((A,B),(C,D));", "XYZ"}, out));
		assertEquals(2, MainRunner.run(new String[] {"frobnicate"}, out));
		assertEquals(0, MainRunner.run(new String[] {"help"}, out));
	}
}
