package treespace.landscape;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntDoubleHashMap;
import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.set.hash.TIntHashSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An undirected graph over integer node ids with a weight on every edge. Self loops and parallel edges are not
 * allowed. Methods returning ids return them in ascending order.
 */
public class LandscapeGraph {

	private TIntObjectHashMap<TIntDoubleHashMap> V;

	public LandscapeGraph() {
		V = new TIntObjectHashMap<TIntDoubleHashMap>();
	}

	/**
	 * @return false if the node was already present
	 */
	public boolean addNode(int id) {
		if (V.containsKey(id)) {
			return false;
		}
		V.put(id, new TIntDoubleHashMap());
		return true;
	}

	/**
	 * Remove a node and every edge touching it.
	 * @return false if the node was not present
	 */
	public boolean removeNode(int id) {
		TIntDoubleHashMap edges = V.remove(id);
		if (edges == null) {
			return false;
		}
		for (int other : edges.keys()) {
			V.get(other).remove(id);
		}
		return true;
	}

	public boolean hasNode(int id) {
		return V.containsKey(id);
	}

	public int size() {
		return V.size();
	}

	public int[] getNodes() {
		int[] ids = V.keys();
		Arrays.sort(ids);
		return ids;
	}

	/**
	 * Connect two nodes. An existing edge keeps its weight.
	 * @return false if the edge already existed
	 */
	public boolean addEdge(int a, int b, double weight) {
		if (a == b) {
			throw new IllegalArgumentException("cannot connect node " + a + " to itself");
		}
		TIntDoubleHashMap ea = edgesOf(a);
		TIntDoubleHashMap eb = edgesOf(b);
		if (ea.containsKey(b)) {
			return false;
		}
		ea.put(b, weight);
		eb.put(a, weight);
		return true;
	}

	public boolean hasEdge(int a, int b) {
		TIntDoubleHashMap ea = V.get(a);
		return ea != null && ea.containsKey(b);
	}

	public double getEdgeWeight(int a, int b) {
		if (!hasEdge(a, b)) {
			throw new IllegalArgumentException("no edge between " + a + " and " + b);
		}
		return V.get(a).get(b);
	}

	public void setEdgeWeight(int a, int b, double weight) {
		if (!hasEdge(a, b)) {
			throw new IllegalArgumentException("no edge between " + a + " and " + b);
		}
		V.get(a).put(b, weight);
		V.get(b).put(a, weight);
	}

	/**
	 * Give every edge the same weight.
	 */
	public void setAllEdgeWeights(double weight) {
		for (int a : V.keys()) {
			TIntDoubleHashMap ea = V.get(a);
			for (int b : ea.keys()) {
				ea.put(b, weight);
			}
		}
	}

	public int[] getNeighbors(int id) {
		int[] n = edgesOf(id).keys();
		Arrays.sort(n);
		return n;
	}

	public int getDegree(int id) {
		return edgesOf(id).size();
	}

	/**
	 * @return every edge once, as {smaller id, larger id}, sorted
	 */
	public List<int[]> getEdges() {
		ArrayList<int[]> edges = new ArrayList<int[]>();
		for (int a : getNodes()) {
			for (int b : getNeighbors(a)) {
				if (a < b) {
					edges.add(new int[] {a, b});
				}
			}
		}
		return edges;
	}

	public int getNumEdges() {
		int d = 0;
		for (int a : V.keys()) {
			d += V.get(a).size();
		}
		return d / 2;
	}

	public int getNumComponents() {
		TIntHashSet seen = new TIntHashSet();
		int components = 0;
		for (int a : getNodes()) {
			if (!seen.contains(a)) {
				components++;
				seen.addAll(breadthFirst(a, -1, null).toArray());
			}
		}
		return components;
	}

	public boolean hasPath(int a, int b) {
		return getShortestPath(a, b) != null;
	}

	/**
	 * @return the ids on a path with the fewest edges from a to b, both ends included, or null if b cannot be reached
	 */
	public int[] getShortestPath(int a, int b) {
		edgesOf(b);
		TIntIntHashMap previous = new TIntIntHashMap();
		TIntArrayList reached = breadthFirst(a, b, previous);
		if (!reached.contains(b)) {
			return null;
		}
		TIntArrayList path = new TIntArrayList();
		int at = b;
		path.add(at);
		while (at != a) {
			at = previous.get(at);
			path.add(at);
		}
		path.reverse();
		return path.toArray();
	}

	/*
	 * visits nodes from start, stopping early at stop if it is reached. when previous is given it receives, for each
	 * visited node but the start, the node it was reached from.
	 */
	private TIntArrayList breadthFirst(int start, int stop, TIntIntHashMap previous) {
		edgesOf(start);
		TIntArrayList queue = new TIntArrayList();
		TIntHashSet seen = new TIntHashSet();
		queue.add(start);
		seen.add(start);
		int head = 0;
		while (head < queue.size()) {
			int at = queue.get(head++);
			if (at == stop) {
				break;
			}
			for (int next : getNeighbors(at)) {
				if (seen.add(next)) {
					if (previous != null) {
						previous.put(next, at);
					}
					queue.add(next);
				}
			}
		}
		return queue;
	}

	private TIntDoubleHashMap edgesOf(int id) {
		TIntDoubleHashMap e = V.get(id);
		if (e == null) {
			throw new IllegalArgumentException("no node " + id + " in graph");
		}
		return e;
	}

	@Override
	public String toString() {
		StringBuffer s = new StringBuffer();
		for (int v : getNodes()) {
			s.append(v);
			for (int w : getNeighbors(v)) {
				s.append("\t" + w);
			}
			s.append("\n");
		}
		return s.toString();
	}
}
