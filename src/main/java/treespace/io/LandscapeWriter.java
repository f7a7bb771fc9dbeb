package treespace.io;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import treespace.bipartition.Bipartition;
import treespace.constants.GeneralConstants;
import treespace.landscape.Landscape;
import treespace.landscape.LandscapeNode;
import treespace.rearrangement.Topology;
import treespace.tree.PhyloTree;

/**
 * Saves a landscape as a JSON document that {@link LandscapeReader} can load back. The document has four members:
 * <ul>
 * <li>metadata: {name, version}</li>
 * <li>trees: one object per tree with id, name, newick, structure, origin, ml, pars, explored and failed</li>
 * <li>graph: one [source, target, weight] triple per edge</li>
 * <li>locks: one {tree, branch} pair per lock, where branch is the post-order index in that tree of the node under
 * the locked branch</li>
 * </ul>
 */
public class LandscapeWriter {

	private static final Logger _LOG = Logger.getLogger(LandscapeWriter.class);

	public static final String ENCODING = "UTF-8";

	public static void write(Landscape landscape, String name, File file) throws IOException {
		FileUtils.writeStringToFile(file, toJSON(landscape, name).toJSONString(), ENCODING);
		_LOG.info("saved " + landscape + " to " + file);
	}

	@SuppressWarnings("unchecked")
	public static JSONObject toJSON(Landscape landscape, String name) {
		JSONObject metadata = new JSONObject();
		metadata.put("name", name);
		metadata.put("version", GeneralConstants.LANDSCAPE_FORMAT_VERSION.value);

		JSONArray trees = new JSONArray();
		for (int id : landscape.getNodeIds()) {
			LandscapeNode node = landscape.getNode(id);
			PhyloTree t = node.getTree();
			JSONObject tree = new JSONObject();
			tree.put("id", id);
			tree.put("name", t.getName());
			tree.put("newick", t.getNewick());
			tree.put("structure", t.getStructure());
			tree.put("origin", t.getOrigin());
			tree.put("ml", t.getLikelihood());
			tree.put("pars", t.getParsimony());
			tree.put("explored", node.isExplored());
			tree.put("failed", node.isFailed());
			trees.add(tree);
		}

		JSONArray graph = new JSONArray();
		for (int[] e : landscape.getEdges()) {
			JSONArray edge = new JSONArray();
			edge.add(e[0]);
			edge.add(e[1]);
			edge.add(landscape.getEdgeWeight(e[0], e[1]));
			graph.add(edge);
		}

		JSONArray locks = new JSONArray();
		for (Bipartition lock : landscape.getLocks()) {
			JSONObject l = locate(landscape, lock);
			if (l == null) {
				_LOG.warn("lock " + lock + " is not found in any tree of the landscape and is not saved");
			} else {
				locks.add(l);
			}
		}

		JSONObject doc = new JSONObject();
		doc.put("metadata", metadata);
		doc.put("trees", trees);
		doc.put("graph", graph);
		doc.put("locks", locks);
		return doc;
	}

	// the first tree, by id, holding the locked split
	@SuppressWarnings("unchecked")
	private static JSONObject locate(Landscape landscape, Bipartition lock) {
		for (int id : landscape.getNodeIds()) {
			Topology topology = landscape.getTree(id).toTopology();
			Bipartition found = new Bipartition(topology, lock.getLeft(), lock.getRight());
			if (found.getBranch() != null) {
				JSONObject l = new JSONObject();
				l.put("tree", id);
				l.put("branch", found.getBranchIndex());
				return l;
			}
		}
		return null;
	}
}
