package treespace.io;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FileUtils;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import treespace.landscape.Landscape;
import treespace.landscape.LandscapeNode;
import treespace.tree.PhyloTree;

/**
 * Writes a landscape as a node-link document for graph viewers. This is an export only, nothing reads it back.
 */
public class LandscapeJSONExporter {

	@SuppressWarnings("unchecked")
	public static JSONObject toJSON(Landscape landscape) {
		JSONArray nodes = new JSONArray();
		for (int id : landscape.getNodeIds()) {
			LandscapeNode node = landscape.getNode(id);
			PhyloTree t = node.getTree();
			JSONObject n = new JSONObject();
			n.put("id", id);
			n.put("name", t.getNewick());
			n.put("ml", t.getLikelihood());
			n.put("pars", t.getParsimony());
			n.put("explored", node.isExplored());
			n.put("localOptimum", landscape.isLocalOptimum(id));
			nodes.add(n);
		}
		JSONArray links = new JSONArray();
		for (int[] e : landscape.getEdges()) {
			JSONObject l = new JSONObject();
			l.put("source", e[0]);
			l.put("target", e[1]);
			l.put("weight", landscape.getEdgeWeight(e[0], e[1]));
			links.add(l);
		}
		JSONObject doc = new JSONObject();
		doc.put("nodes", nodes);
		doc.put("links", links);
		return doc;
	}

	public static void write(Landscape landscape, File file) throws IOException {
		FileUtils.writeStringToFile(file, toJSON(landscape).toJSONString(), LandscapeWriter.ENCODING);
	}
}
