package treespace.landscape;

import treespace.scoring.Score;
import treespace.tree.PhyloTree;

/**
 * The record a landscape keeps for each of its trees.
 */
public class LandscapeNode {

	private final int id;
	private final PhyloTree tree;
	private ExplorationState state;
	private boolean failed;

	LandscapeNode(int id, PhyloTree tree) {
		this.id = id;
		this.tree = tree;
		this.state = ExplorationState.UNEXPLORED;
		this.failed = false;
	}

	public int getId() {return id;}

	public PhyloTree getTree() {return tree;}

	public Score getScore() {return tree.getScore();}

	public ExplorationState getState() {return state;}

	public boolean isExplored() {return state == ExplorationState.EXPLORED;}

	/**
	 * @return true if scoring this tree has failed at least once
	 */
	public boolean isFailed() {return failed;}

	public void markFailed() {failed = true;}

	/**
	 * Record that the whole neighborhood of this tree is in the landscape, e.g. when reloading a saved landscape.
	 */
	public void markExplored() {state = ExplorationState.EXPLORED;}

	void startExploring() {
		if (state == ExplorationState.UNEXPLORED) {
			state = ExplorationState.EXPLORING;
		}
	}

	@Override
	public String toString() {
		return id + "\t" + state + (failed ? "\tfailed\t" : "\t") + tree.getScore() + "\t" + tree.getNewick();
	}
}
