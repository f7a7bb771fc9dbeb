package treespace.io;

import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.map.hash.TIntObjectHashMap;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;
import org.json.simple.parser.ParseException;

import treespace.bipartition.Bipartition;
import treespace.constants.GeneralConstants;
import treespace.exceptions.LandscapeFormatException;
import treespace.exceptions.TreeParseException;
import treespace.landscape.Landscape;
import treespace.scoring.Alignment;
import treespace.scoring.Score;
import treespace.scoring.TreeScorer;
import treespace.tree.PhyloTree;

/**
 * Loads a landscape saved by {@link LandscapeWriter}. Trees get new ids in the order of their saved ids, so a
 * landscape saved without removals comes back with the same ids. Scores are taken from the file, not recomputed.
 */
public class LandscapeReader {

	private static final Logger _LOG = Logger.getLogger(LandscapeReader.class);

	public static Landscape read(File file, Alignment alignment, TreeScorer scorer) throws IOException, LandscapeFormatException {
		String text = FileUtils.readFileToString(file, LandscapeWriter.ENCODING);
		Object parsed;
		try {
			parsed = JSONValue.parseWithException(text);
		} catch (ParseException pe) {
			throw new LandscapeFormatException("file " + file + " is not valid JSON: " + pe, pe);
		}
		if (!(parsed instanceof JSONObject)) {
			throw new LandscapeFormatException("file " + file + " does not hold a JSON object");
		}
		Landscape landscape = fromJSON((JSONObject) parsed, alignment, scorer);
		_LOG.info("loaded " + landscape + " from " + file);
		return landscape;
	}

	public static Landscape fromJSON(JSONObject doc, Alignment alignment, TreeScorer scorer) throws LandscapeFormatException {
		JSONObject metadata = get(doc, "metadata", JSONObject.class);
		String version = get(metadata, "version", String.class);
		if (!GeneralConstants.LANDSCAPE_FORMAT_VERSION.value.equals(version)) {
			throw new LandscapeFormatException("unsupported version " + version);
		}
		Landscape landscape = new Landscape(alignment, scorer);

		TIntObjectHashMap<JSONObject> saved = new TIntObjectHashMap<JSONObject>();
		for (Object o : get(doc, "trees", JSONArray.class)) {
			if (!(o instanceof JSONObject)) {
				throw new LandscapeFormatException("tree record " + o + " is not an object");
			}
			int id = getInt((JSONObject) o, "id");
			if (saved.containsKey(id)) {
				throw new LandscapeFormatException("tree id " + id + " is used twice");
			}
			saved.put(id, (JSONObject) o);
		}
		int[] order = saved.keys();
		Arrays.sort(order);

		TIntIntHashMap ids = new TIntIntHashMap();
		for (int old : order) {
			JSONObject t = saved.get(old);
			PhyloTree tree = readTree(t);
			if (landscape.findTreeTopologyByStructure(tree.getStructure()) != null) {
				throw new LandscapeFormatException("tree " + old + " repeats the structure " + tree.getStructure());
			}
			int id = landscape.addTree(tree, false);
			if (Boolean.TRUE.equals(t.get("explored"))) {
				landscape.getNode(id).markExplored();
			}
			if (Boolean.TRUE.equals(t.get("failed"))) {
				landscape.getNode(id).markFailed();
			}
			ids.put(old, id);
		}

		for (Object o : get(doc, "graph", JSONArray.class)) {
			if (!(o instanceof JSONArray) || ((JSONArray) o).size() < 2) {
				throw new LandscapeFormatException("edge " + o + " is not a [source, target, weight] triple");
			}
			JSONArray e = (JSONArray) o;
			int a = mapId(ids, e.get(0));
			int b = mapId(ids, e.get(1));
			if (e.size() > 2 && e.get(2) != null) {
				landscape.addEdge(a, b, toDouble(e.get(2)));
			} else {
				landscape.addEdge(a, b);
			}
		}

		JSONArray locks = (JSONArray) doc.get("locks");
		if (locks != null) {
			for (Object o : locks) {
				if (!(o instanceof JSONObject)) {
					throw new LandscapeFormatException("lock " + o + " is not an object");
				}
				JSONObject l = (JSONObject) o;
				int tree = mapId(ids, l.get("tree"));
				Bipartition bi;
				try {
					bi = landscape.getBipartitionFoundInTreeByIndex(tree, getInt(l, "branch"));
				} catch (IllegalArgumentException iae) {
					throw new LandscapeFormatException("lock " + l + " does not name a branch", iae);
				}
				if (!landscape.getLocks().contains(bi)) {
					landscape.toggleLock(bi);
				}
			}
		}
		return landscape;
	}

	private static PhyloTree readTree(JSONObject t) throws LandscapeFormatException {
		String newick = get(t, "newick", String.class);
		PhyloTree tree;
		try {
			tree = new PhyloTree(newick, true);
		} catch (TreeParseException tpe) {
			throw new LandscapeFormatException("tree " + t.get("id") + " has a bad newick string: " + tpe, tpe);
		}
		Object structure = t.get("structure");
		if (structure != null && !structure.equals(tree.getStructure())) {
			throw new LandscapeFormatException("tree " + t.get("id") + " does not match its stored structure " + structure);
		}
		tree.setName((String) t.get("name"));
		tree.setOrigin((String) t.get("origin"));
		tree.setScore(new Score(toDouble(t.get("ml")), toDouble(t.get("pars"))));
		return tree;
	}

	private static <T> T get(JSONObject o, String key, Class<T> type) throws LandscapeFormatException {
		Object v = o.get(key);
		if (v == null) {
			throw new LandscapeFormatException("missing field '" + key + "'");
		}
		if (!type.isInstance(v)) {
			throw new LandscapeFormatException("field '" + key + "' should be a " + type.getSimpleName());
		}
		return type.cast(v);
	}

	private static int getInt(JSONObject o, String key) throws LandscapeFormatException {
		return get(o, key, Number.class).intValue();
	}

	private static int mapId(TIntIntHashMap ids, Object saved) throws LandscapeFormatException {
		if (!(saved instanceof Number) || !ids.containsKey(((Number) saved).intValue())) {
			throw new LandscapeFormatException("reference to unknown tree " + saved);
		}
		return ids.get(((Number) saved).intValue());
	}

	private static Double toDouble(Object v) throws LandscapeFormatException {
		if (v == null) {
			return null;
		}
		if (!(v instanceof Number)) {
			throw new LandscapeFormatException("score " + v + " is not a number");
		}
		return ((Number) v).doubleValue();
	}
}
