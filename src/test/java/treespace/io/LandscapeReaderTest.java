package treespace.io;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import treespace.exceptions.LandscapeFormatException;
import treespace.exceptions.TreeParseException;
import treespace.landscape.Landscape;
import treespace.scoring.Score;
import treespace.tree.PhyloTree;

public class LandscapeReaderTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	protected Landscape ls;

	@Before
	public void prepareLandscape() throws TreeParseException {
		ls = new Landscape(null, null, new PhyloTree("(((A,B),C),(D,E));"));
		ls.toggleLock(ls.getBipartitionFoundInTreeByIndex(0, 6));
		List<Integer> added = ls.exploreTree(0);
		ls.exploreTree(added.get(0));
		ls.getTree(0).setScore(new Score(-12.5, 7.0));
		ls.getTree(0).setName("start");
		ls.getNode(added.get(1)).markFailed();
		ls.setEdgeWeight(0, added.get(0), 3.0);
	}

	@Test
	public void savedLandscapeLoadsBackTheSame() throws IOException, LandscapeFormatException {
		File f = folder.newFile("landscape.json");
		LandscapeWriter.write(ls, "test", f);
		Landscape back = LandscapeReader.read(f, null, null);

		assertEquals(ls.size(), back.size());
		for (int id : ls.getNodeIds()) {
			PhyloTree a = ls.getTree(id);
			PhyloTree b = back.getTree(id);
			assertEquals(a.getStructure(), b.getStructure());
			assertEquals(a.getNewick(), b.getNewick());
			assertEquals(a.getOrigin(), b.getOrigin());
			assertEquals(a.getLikelihood(), b.getLikelihood());
			assertEquals(a.getParsimony(), b.getParsimony());
			assertEquals(ls.getNode(id).isExplored(), back.getNode(id).isExplored());
			assertEquals(ls.getNode(id).isFailed(), back.getNode(id).isFailed());
		}
		assertEquals("start", back.getTree(0).getName());
		assertEquals(ls.getNumEdges(), back.getNumEdges());
		for (int[] e : ls.getEdges()) {
			assertTrue(back.hasEdge(e[0], e[1]));
			assertEquals(ls.getEdgeWeight(e[0], e[1]), back.getEdgeWeight(e[0], e[1]), 0.0);
		}
		assertEquals(ls.getLocks(), back.getLocks());
		assertEquals(Integer.valueOf(0), back.getRoot());
	}

	@Test
	public void documentLayout() {
		JSONObject doc = LandscapeWriter.toJSON(ls, "test");
		assertEquals("test", ((JSONObject) doc.get("metadata")).get("name"));
		assertEquals(ls.size(), ((JSONArray) doc.get("trees")).size());
		assertEquals(ls.getNumEdges(), ((JSONArray) doc.get("graph")).size());
		assertEquals(1, ((JSONArray) doc.get("locks")).size());
	}

	@Test(expected = LandscapeFormatException.class)
	public void notJSON() throws IOException, LandscapeFormatException {
		File f = folder.newFile("bad.json");
		FileUtils.writeStringToFile(f, "{trees: [", "UTF-8");
		LandscapeReader.read(f, null, null);
	}

	@Test(expected = LandscapeFormatException.class)
	public void wrongVersion() throws IOException, LandscapeFormatException {
		File f = folder.newFile("old.json");
		FileUtils.writeStringToFile(f, "{\"metadata\": {\"name\": \"x\", \"version\": \"0.1\"}, \"trees\": [], \"graph\": []}", "UTF-8");
		LandscapeReader.read(f, null, null);
	}

	@Test(expected = LandscapeFormatException.class)
	public void edgeToUnknownTree() throws IOException, LandscapeFormatException {
		File f = folder.newFile("dangling.json");
		FileUtils.writeStringToFile(f, "{\"metadata\": {\"name\": \"x\", \"version\": \"1.0\"}, "
				+ "\"trees\": [{\"id\": 0, \"newick\": \"((A,B),(C,D));\"}], \"graph\": [[0, 4, 0.0]]}", "UTF-8");
		LandscapeReader.read(f, null, null);
	}

	@Test
	public void exportsNodeLinkDocument() throws IOException {
		JSONObject doc = LandscapeJSONExporter.toJSON(ls);
		assertEquals(ls.size(), ((JSONArray) doc.get("nodes")).size());
		assertEquals(ls.getNumEdges(), ((JSONArray) doc.get("links")).size());
		File f = folder.newFile("graph.json");
		LandscapeJSONExporter.write(ls, f);
		assertTrue(FileUtils.readFileToString(f, "UTF-8").contains("\"links\""));
	}
}
