package treespace.tree;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

import treespace.exceptions.TreeParseException;

/**
 * An ordered collection of trees that can be written to and read from a tree file (one newick string per line).
 */
public class PhyloTreeSet implements Iterable<PhyloTree> {

	private ArrayList<PhyloTree> trees;

	public PhyloTreeSet() {
		trees = new ArrayList<PhyloTree>();
	}

	public void addTree(PhyloTree t) {
		trees.add(t);
	}

	public void addTrees(Iterable<PhyloTree> ts) {
		for (PhyloTree t : ts) {
			trees.add(t);
		}
	}

	public boolean removeTree(PhyloTree t) {
		return trees.remove(t);
	}

	/**
	 * @return the position of a tree with the same structure, or -1
	 */
	public int indexOf(PhyloTree t) {
		return trees.indexOf(t);
	}

	public PhyloTree getTree(int i) {
		return trees.get(i);
	}

	public int size() {
		return trees.size();
	}

	@Override
	public Iterator<PhyloTree> iterator() {
		return trees.iterator();
	}

	public void toTreeFile(File f) throws IOException {
		ArrayList<String> lines = new ArrayList<String>();
		for (PhyloTree t : trees) {
			lines.add(t.getNewick());
		}
		FileUtils.writeLines(f, "UTF-8", lines, "\n");
	}

	/**
	 * Read every non-blank line of a tree file as a newick string. Trees are stored as found.
	 */
	public static PhyloTreeSet fromTreeFile(File f) throws IOException, TreeParseException {
		PhyloTreeSet ts = new PhyloTreeSet();
		List<String> lines = FileUtils.readLines(f, "UTF-8");
		for (String line : lines) {
			if (StringUtils.isBlank(line)) {
				continue;
			}
			ts.addTree(new PhyloTree(line.trim(), false));
		}
		return ts;
	}
}
