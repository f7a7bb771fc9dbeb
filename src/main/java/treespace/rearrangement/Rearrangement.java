package treespace.rearrangement;

import treespace.exceptions.TreeParseException;
import treespace.tree.PhyloTree;
import treespace.tree.TreeBranch;

/**
 * A pending move of the subtree under one branch of a topology onto another branch. Nothing is computed until the
 * move is turned into a topology, tree or newick string, so large numbers of candidates can be listed cheaply.
 */
public class Rearrangement {

	private Topology topology;
	private TreeBranch target;
	private TreeBranch destination;
	private RearrangementType type;

	public Rearrangement(Topology topology, TreeBranch target, TreeBranch destination, RearrangementType type) {
		this.topology = topology;
		this.target = target;
		this.destination = destination;
		this.type = type;
	}

	public Topology getTopology() {return topology;}

	/**
	 * @return the branch whose subtree moves
	 */
	public TreeBranch getTarget() {return target;}

	public TreeBranch getDestination() {return destination;}

	public RearrangementType getType() {return type;}

	public String getTypeName() {return type.getName();}

	public boolean isSPR() {return type == RearrangementType.SPR;}

	public boolean isNNI() {return type == RearrangementType.NNI;}

	public boolean isTBR() {return type == RearrangementType.TBR;}

	/**
	 * @return the canonical topology after the move
	 */
	public Topology toTopology() {
		return topology.move(target, destination);
	}

	/**
	 * @return the newick string after the move, rooted as the source topology and not canonical
	 */
	public String toNewick() {
		return topology.moveToNewick(target, destination);
	}

	/**
	 * @return the canonical tree after the move, its origin set to the name of the move type
	 */
	public PhyloTree toTree() {
		PhyloTree t;
		try {
			t = new PhyloTree(toNewick(), true);
		} catch (TreeParseException tpe) {
			throw new IllegalStateException("could not read back a generated tree", tpe);
		}
		t.setOrigin(type.getName());
		return t;
	}

	@Override
	public String toString() {
		return "<" + type.getName() + "> move " + target + " to " + destination;
	}
}
