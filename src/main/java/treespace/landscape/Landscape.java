package treespace.landscape;

import gnu.trove.map.hash.TIntObjectHashMap;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.apache.log4j.Logger;

import treespace.bipartition.Bipartition;
import treespace.constants.GeneralConstants;
import treespace.exceptions.RearrangementException;
import treespace.exceptions.ScoringException;
import treespace.exceptions.TreeParseException;
import treespace.rearrangement.Rearrangement;
import treespace.rearrangement.RearrangementType;
import treespace.rearrangement.Topology;
import treespace.scoring.Alignment;
import treespace.scoring.TreeScorer;
import treespace.tree.PhyloTree;
import treespace.tree.PhyloTreeSet;
import treespace.tree.TreeBranch;
import treespace.tree.TreeNode;
import treespace.tree.TreeUtils;

/**
 * A graph of distinct tree topologies over one set of taxa, where two trees are connected when a single
 * rearrangement turns one into the other.
 *
 * Trees are identified by their canonical structure: no two trees in a landscape share one, and every tree gets an
 * id that is never handed out again, even after the tree is removed. Neighborhoods are added on demand with
 * {@link #exploreTree(int)} and {@link #exploreRandomTree(int)}. Parsimony is computed when a tree is added;
 * likelihoods only when asked for with {@link #scoreLikelihood(int)}. A scoring failure flags the tree as failed and
 * is otherwise ignored.
 *
 * Locked bipartitions are never crossed while exploring.
 *
 * A landscape is not thread safe. Callers sharing one between threads must serialize every call.
 */
public class Landscape implements Iterable<PhyloTree> {

	private static final Logger _LOG = Logger.getLogger(Landscape.class);

	private Alignment alignment;
	private TreeScorer scorer;
	private LandscapeGraph graph;
	private TIntObjectHashMap<LandscapeNode> nodes;
	private HashMap<String, Integer> structureIndex;
	private ArrayList<Bipartition> locks;
	private Integer root;
	private int nextTree;
	private RearrangementType operator;
	private double defaultWeight;
	private Random random;

	/**
	 * An empty landscape.
	 * @param alignment the data trees are scored against; may be null
	 * @param scorer may be null, in which case nothing is scored
	 */
	public Landscape(Alignment alignment, TreeScorer scorer) {
		this.alignment = alignment;
		this.scorer = scorer;
		this.graph = new LandscapeGraph();
		this.nodes = new TIntObjectHashMap<LandscapeNode>();
		this.structureIndex = new HashMap<String, Integer>();
		this.locks = new ArrayList<Bipartition>();
		this.root = null;
		this.nextTree = 0;
		this.operator = RearrangementType.SPR;
		this.defaultWeight = (Double) GeneralConstants.DEFAULT_EDGE_WEIGHT.value;
		this.random = new Random();
	}

	/**
	 * A landscape holding one starting tree, which becomes its root.
	 * @param startingTree the root tree, or null to start from the alignment's initial tree
	 */
	public Landscape(Alignment alignment, TreeScorer scorer, PhyloTree startingTree) throws TreeParseException {
		this(alignment, scorer);
		if (startingTree == null) {
			if (alignment == null) {
				throw new IllegalArgumentException("a starting tree or an alignment is needed");
			}
			startingTree = new PhyloTree(alignment.getInitialTree());
		}
		addTree(startingTree);
	}

	/*
	 * settings
	 */

	public Alignment getAlignment() {return alignment;}

	public TreeScorer getScorer() {return scorer;}

	public RearrangementType getOperator() {return operator;}

	/**
	 * Set the rearrangement used when none is named.
	 */
	public void setOperator(RearrangementType operator) {this.operator = operator;}

	public double getDefaultWeight() {return defaultWeight;}

	/**
	 * Set the weight given to edges added from now on.
	 */
	public void setDefaultWeight(double w) {this.defaultWeight = w;}

	/**
	 * Set the source of randomness for {@link #exploreRandomTree(int)}.
	 */
	public void setRandom(Random random) {this.random = random;}

	/*
	 * insertion and removal
	 */

	public int addTree(PhyloTree tree) {
		return addTree(tree, true);
	}

	/**
	 * Trees not in canonical form are stored as a canonical copy.
	 * @param score if true, compute the tree's parsimony now
	 * @return the id of the new tree
	 * @throws AssertionError if a tree with the same structure is already in the landscape
	 */
	public int addTree(PhyloTree tree, boolean score) {
		tree = tree.toCanonical();
		Integer existing = structureIndex.get(tree.getStructure());
		if (existing != null) {
			throw new AssertionError("Tree " + tree.getStructure() + " already exists in landscape as " + existing);
		}
		int id = nextTree++;
		nodes.put(id, new LandscapeNode(id, tree));
		graph.addNode(id);
		structureIndex.put(tree.getStructure(), id);
		if (root == null) {
			root = id;
		}
		if (score) {
			scoreParsimony(id);
		}
		return id;
	}

	public int addTreeByNewick(String newick) throws TreeParseException {
		return addTreeByNewick(newick, true);
	}

	public int addTreeByNewick(String newick, boolean score) throws TreeParseException {
		return addTree(new PhyloTree(newick), score);
	}

	/**
	 * Remove a tree, its edges and its structure from the landscape.
	 * @return the removed tree
	 */
	public PhyloTree removeTreeByIndex(int id) {
		LandscapeNode node = nodes.remove(id);
		if (node == null) {
			throw new IllegalArgumentException("no tree " + id + " in landscape");
		}
		graph.removeNode(id);
		structureIndex.remove(node.getTree().getStructure());
		if (root != null && root == id) {
			root = null;
		}
		return node.getTree();
	}

	/**
	 * @return false if no tree with the same structure was in the landscape
	 */
	public boolean removeTree(PhyloTree tree) {
		Integer id = indexOf(tree);
		if (id == null) {
			return false;
		}
		removeTreeByIndex(id);
		return true;
	}

	/*
	 * scoring
	 */

	private void scoreParsimony(int id) {
		if (scorer == null) {
			return;
		}
		LandscapeNode node = nodes.get(id);
		PhyloTree tree = node.getTree();
		try {
			Double p = scorer.getParsimony(tree.getNewick(), alignment);
			tree.setScore(tree.getScore().withParsimony(p));
		} catch (ScoringException sx) {
			node.markFailed();
			_LOG.warn("parsimony scoring failed for tree " + id + ": " + sx.getMessage());
		}
	}

	/**
	 * Compute the log-likelihood of a tree if it does not have one yet.
	 * @return the log-likelihood, or null if there is no scorer, the scorer gives none, or scoring failed
	 */
	public Double scoreLikelihood(int id) {
		LandscapeNode node = getNode(id);
		PhyloTree tree = node.getTree();
		if (tree.getLikelihood() != null) {
			return tree.getLikelihood();
		}
		if (scorer == null) {
			return null;
		}
		try {
			Double l = scorer.getLogLikelihood(tree.getNewick(), alignment);
			if (l != null) {
				tree.setScore(tree.getScore().withLikelihood(l));
			}
			return l;
		} catch (ScoringException sx) {
			node.markFailed();
			_LOG.warn("likelihood scoring failed for tree " + id + ": " + sx.getMessage());
			return null;
		}
	}

	/*
	 * exploration
	 */

	public List<Integer> exploreTree(int id) {
		return exploreTree(id, operator);
	}

	/**
	 * Add every tree one move of the given type away from a tree, and connect them to it. Trees already in the
	 * landscape are connected, not added again. The tree is then marked explored.
	 *
	 * @return ids of the trees added, empty if the tree was already explored
	 * @throws RearrangementException for a type that cannot be enumerated
	 */
	public List<Integer> exploreTree(int id, RearrangementType type) {
		LandscapeNode node = getNode(id);
		ArrayList<Integer> added = new ArrayList<Integer>();
		if (node.isExplored()) {
			return added;
		}
		node.startExploring();
		Topology topology = lockedTopology(node.getTree());
		boolean violating = isViolating(topology);
		int connected = 0;
		for (Rearrangement r : topology.allType(type)) {
			Placement p = place(id, r, violating);
			if (p == null) {
				continue;
			}
			if (p.newNode) {
				added.add(p.id);
			} else if (p.newEdge) {
				connected++;
			}
		}
		node.markExplored();
		_LOG.info("explored tree " + id + " by " + type.getName() + ": " + added.size() + " new trees, "
				+ connected + " new edges to known trees");
		return added;
	}

	public Integer exploreRandomTree(int id) {
		return exploreRandomTree(id, operator);
	}

	/**
	 * Try the moves of a tree in random order and stop at the first one that adds a tree or connects a known tree to
	 * this one. The tree is not marked explored, even when nothing new is left.
	 *
	 * @return the id of the added or newly connected tree, or null if there was none or the tree is already explored
	 */
	public Integer exploreRandomTree(int id, RearrangementType type) {
		LandscapeNode node = getNode(id);
		if (node.isExplored()) {
			return null;
		}
		Topology topology = lockedTopology(node.getTree());
		boolean violating = isViolating(topology);
		ArrayList<TreeBranch> branches = new ArrayList<TreeBranch>(topology.getBranches());
		Collections.shuffle(branches, random);
		for (TreeBranch br : branches) {
			ArrayList<Rearrangement> moves = new ArrayList<Rearrangement>(topology.allTypeForBranch(br, type));
			Collections.shuffle(moves, random);
			for (Rearrangement r : moves) {
				Placement p = place(id, r, violating);
				if (p != null && (p.newNode || p.newEdge)) {
					_LOG.debug("random exploration of tree " + id + " reached tree " + p.id);
					return p.id;
				}
			}
		}
		return null;
	}

	/*
	 * where the result of one move ended up
	 */
	private static class Placement {
		final int id;
		final boolean newNode;
		final boolean newEdge;

		Placement(int id, boolean newNode, boolean newEdge) {
			this.id = id;
			this.newNode = newNode;
			this.newEdge = newEdge;
		}
	}

	/*
	 * null when the move leads back to the origin, or when the origin already broke a lock and so does the result
	 */
	private Placement place(int origin, Rearrangement r, boolean checkLocks) {
		PhyloTree t = r.toTree();
		Integer existing = structureIndex.get(t.getStructure());
		if (existing != null) {
			if (existing == origin) {
				return null;
			}
			boolean newEdge = graph.addEdge(origin, existing, defaultWeight);
			return new Placement(existing, false, newEdge);
		}
		if (checkLocks && isViolating(t.toTopology())) {
			return null;
		}
		int id = addTree(t, true);
		graph.addEdge(origin, id, defaultWeight);
		return new Placement(id, true, true);
	}

	// the tree's topology with the landscape's locks applied to it
	private Topology lockedTopology(PhyloTree tree) {
		Topology topology = tree.toTopology();
		for (Bipartition lock : locks) {
			TreeBranch br = topology.getBranchFromBipartition(lock);
			if (br != null) {
				topology.lockBranch(br);
			}
		}
		return topology;
	}

	/*
	 * locks
	 */

	public List<Bipartition> getLocks() {
		return Collections.unmodifiableList(locks);
	}

	/**
	 * Lock a bipartition, or unlock it if it is already locked.
	 * @return true if the bipartition is now locked
	 */
	public boolean toggleLock(Bipartition bi) {
		if (locks.remove(bi)) {
			_LOG.info("unlocked " + bi);
			return false;
		}
		locks.add(bi);
		_LOG.info("locked " + bi);
		return true;
	}

	/**
	 * Toggle the lock on the bipartition made by a branch of (a copy of) the given tree.
	 * @return true if the bipartition is now locked
	 * @throws RearrangementException if the tree has no such bipartition
	 */
	public boolean lockBranchFoundInTree(int id, TreeBranch br) {
		Bipartition bi = Bipartition.matching(getTree(id).toTopology(), br);
		if (bi.getBranch() == null) {
			throw new RearrangementException("bipartition " + bi + " not found in tree " + id);
		}
		return toggleLock(bi);
	}

	/**
	 * @param index position, in post-order, of the node under the branch
	 */
	public Bipartition getBipartitionFoundInTreeByIndex(int id, int index) {
		Topology topology = getTree(id).toTopology();
		List<TreeNode> order = TreeUtils.postOrderTraversal(topology.getRoot());
		if (index < 0 || index >= order.size() || order.get(index).getParent() == null) {
			throw new IllegalArgumentException("no branch at post-order index " + index + " in tree " + id);
		}
		return new Bipartition(topology, order.get(index).getParent());
	}

	/**
	 * @return true if the bipartition is now locked
	 */
	public boolean lockBranchFoundInTreeByIndex(int id, int index) {
		return toggleLock(getBipartitionFoundInTreeByIndex(id, index));
	}

	/**
	 * @return true if some locked bipartition is missing from the topology
	 */
	public boolean isViolating(Topology topology) {
		for (Bipartition lock : locks) {
			if (topology.getBranchFromBipartition(lock) == null) {
				return true;
			}
		}
		return false;
	}

	public boolean isViolating(int id) {
		if (locks.isEmpty()) {
			return false;
		}
		return isViolating(getTree(id).toTopology());
	}

	/*
	 * lookups
	 */

	public LandscapeNode getNode(int id) {
		LandscapeNode node = nodes.get(id);
		if (node == null) {
			throw new IllegalArgumentException("no tree " + id + " in landscape");
		}
		return node;
	}

	public PhyloTree getTree(int id) {
		return getNode(id).getTree();
	}

	public Vertex getVertex(int id) {
		getNode(id);
		return new Vertex(this, id);
	}

	public boolean hasTree(int id) {
		return nodes.containsKey(id);
	}

	/**
	 * @return the id of the tree with the given canonical structure, or null
	 */
	public Integer findTreeTopologyByStructure(String structure) {
		return structureIndex.get(structure);
	}

	/**
	 * @return the id of the tree with the same topology as the newick string, or null
	 */
	public Integer findTreeTopology(String newick) throws TreeParseException {
		return findTreeTopologyByStructure(Topology.fromNewick(newick).toStructure());
	}

	/**
	 * @return the landscape's tree with the same topology as the newick string, or null
	 */
	public PhyloTree findTree(String newick) throws TreeParseException {
		Integer id = findTreeTopology(newick);
		return id == null ? null : getTree(id);
	}

	/**
	 * @return the id of the tree with the same structure, or null
	 */
	public Integer indexOf(PhyloTree tree) {
		return findTreeTopologyByStructure(tree.toCanonical().getStructure());
	}

	/**
	 * @return the id of the first tree added, or null if it has been removed or nothing was added yet
	 */
	public Integer getRoot() {return root;}

	/**
	 * @return the first tree added, or null
	 */
	public PhyloTree getRootTree() {
		return root == null ? null : getTree(root);
	}

	public int size() {return nodes.size();}

	/**
	 * @return ids of all trees, ascending
	 */
	public int[] getNodeIds() {return graph.getNodes();}

	/**
	 * Trees in ascending id order.
	 */
	@Override
	public Iterator<PhyloTree> iterator() {
		ArrayList<PhyloTree> trees = new ArrayList<PhyloTree>();
		for (int id : getNodeIds()) {
			trees.add(getTree(id));
		}
		return trees.iterator();
	}

	public PhyloTreeSet toTreeSet() {
		PhyloTreeSet ts = new PhyloTreeSet();
		ts.addTrees(this);
		return ts;
	}

	/**
	 * @return the number of taxa of the alignment, or else of any tree in the landscape; 0 when there is neither
	 */
	public int getNumberTaxa() {
		if (alignment != null) {
			return alignment.getNumTaxa();
		}
		for (PhyloTree t : this) {
			return t.toTopology().getNumLeaves();
		}
		return 0;
	}

	public BigInteger getPossibleNumberUnrootedTrees() {
		return TreeUtils.numberUnrootedTrees(getNumberTaxa());
	}

	public BigInteger getPossibleNumberRootedTrees() {
		return TreeUtils.numberRootedTrees(getNumberTaxa());
	}

	/*
	 * graph
	 */

	public int[] getNeighborsFor(int id) {return graph.getNeighbors(id);}

	public int getDegreeFor(int id) {return graph.getDegree(id);}

	/**
	 * Connect two trees with the default weight.
	 * @return false if they were already connected
	 */
	public boolean addEdge(int a, int b) {return graph.addEdge(a, b, defaultWeight);}

	public boolean addEdge(int a, int b, double weight) {return graph.addEdge(a, b, weight);}

	public boolean hasEdge(int a, int b) {return graph.hasEdge(a, b);}

	public double getEdgeWeight(int a, int b) {return graph.getEdgeWeight(a, b);}

	public void setEdgeWeight(int a, int b, double weight) {graph.setEdgeWeight(a, b, weight);}

	/**
	 * Reset every edge to the default weight.
	 */
	public void clearEdgeWeights() {graph.setAllEdgeWeights(defaultWeight);}

	public List<int[]> getEdges() {return graph.getEdges();}

	public int getNumEdges() {return graph.getNumEdges();}

	public int getNumComponents() {return graph.getNumComponents();}

	public boolean hasPath(int a, int b) {return graph.hasPath(a, b);}

	/**
	 * @return ids on a path with the fewest moves from a to b, both included, or null if there is none
	 */
	public List<Integer> getShortestPath(int a, int b) {
		int[] path = graph.getShortestPath(a, b);
		if (path == null) {
			return null;
		}
		ArrayList<Integer> out = new ArrayList<Integer>();
		for (int p : path) {
			out.add(p);
		}
		return out;
	}

	/*
	 * improvement and optima. all of these use likelihoods only and never trigger scoring.
	 */

	/**
	 * @return the neighbor with the highest likelihood if it is strictly higher than the tree's own; the lowest id
	 *		among equally good neighbors; null if the tree has no likelihood or no neighbor improves on it
	 */
	public Integer getBestImprovement(int id) {
		Double own = getTree(id).getLikelihood();
		if (own == null) {
			return null;
		}
		Integer best = null;
		double bestScore = own;
		for (int n : getNeighborsFor(id)) {
			Double s = getTree(n).getLikelihood();
			if (s != null && s > bestScore) {
				best = n;
				bestScore = s;
			}
		}
		return best;
	}

	/**
	 * Follow best improvements from a tree until none is left.
	 * @return the trees visited after the starting one, in order; empty if the tree cannot be improved
	 */
	public List<Integer> getPathOfBestImprovement(int id) {
		ArrayList<Integer> path = new ArrayList<Integer>();
		Integer next = getBestImprovement(id);
		while (next != null) {
			path.add(next);
			next = getBestImprovement(next);
		}
		return path;
	}

	/**
	 * @return the path of best improvement of every tree, keyed by id in ascending order
	 */
	public Map<Integer, List<Integer>> getAllPathsOfBestImprovement() {
		LinkedHashMap<Integer, List<Integer>> paths = new LinkedHashMap<Integer, List<Integer>>();
		for (int id : getNodeIds()) {
			paths.put(id, getPathOfBestImprovement(id));
		}
		return paths;
	}

	/**
	 * A tree is a local optimum when it has a likelihood, it has been explored, and no neighbor has a higher
	 * likelihood. A neighbor without a likelihood leaves the question open unless its scoring failed.
	 */
	public boolean isLocalOptimum(int id) {
		LandscapeNode node = getNode(id);
		Double own = node.getTree().getLikelihood();
		if (own == null || !node.isExplored()) {
			return false;
		}
		for (int n : getNeighborsFor(id)) {
			LandscapeNode other = getNode(n);
			Double s = other.getTree().getLikelihood();
			if (s == null) {
				if (!other.isFailed()) {
					return false;
				}
			} else if (s > own) {
				return false;
			}
		}
		return true;
	}

	public List<Integer> getLocalOptima() {
		ArrayList<Integer> optima = new ArrayList<Integer>();
		for (int id : getNodeIds()) {
			if (isLocalOptimum(id)) {
				optima.add(id);
			}
		}
		return optima;
	}

	/**
	 * @return the local optimum with the highest likelihood, the lowest id among ties, or null if there is none
	 */
	public Integer getGlobalOptimum() {
		Integer best = null;
		double bestScore = 0;
		for (int id : getLocalOptima()) {
			double s = getTree(id).getLikelihood();
			if (best == null || s > bestScore) {
				best = id;
				bestScore = s;
			}
		}
		return best;
	}

	@Override
	public String toString() {
		return "landscape of " + size() + " trees, " + getNumEdges() + " edges, " + locks.size() + " locks";
	}
}
