package treespace;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.LinkedHashSet;
import java.util.LinkedList;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import treespace.exceptions.RearrangementException;
import treespace.exceptions.TreeParseException;
import treespace.io.LandscapeWriter;
import treespace.landscape.Landscape;
import treespace.rearrangement.Rearrangement;
import treespace.rearrangement.RearrangementType;
import treespace.rearrangement.Topology;
import treespace.tree.PhyloTree;
import treespace.tree.TreeUtils;

public class MainRunner {

	private static final Logger _LOG = Logger.getLogger(MainRunner.class);

	private PrintStream out;

	public MainRunner(PrintStream out) {
		this.out = out;
	}

	// @returns 0 for success, 2 for poorly formed command
	public int count(String[] args) {
		if (args.length != 2 || !StringUtils.isNumeric(args[1])) {
			System.err.println("arguments should be: ntaxa");
			return 2;
		}
		int ntaxa;
		try {
			ntaxa = Integer.parseInt(args[1]);
		} catch (NumberFormatException nfe) {
			System.err.println("ntaxa is too large: " + args[1]);
			return 2;
		}
		out.println(TreeUtils.numberUnrootedTrees(ntaxa));
		return 0;
	}

	public int reroot(String[] args) throws TreeParseException {
		if (args.length != 2) {
			System.err.println("arguments should be: newick");
			return 2;
		}
		out.println(Topology.fromNewick(args[1]).toNewick());
		return 0;
	}

	public int neighbors(String[] args) throws TreeParseException {
		if (args.length != 2 && args.length != 3) {
			System.err.println("arguments should be: newick [SPR|NNI]");
			return 2;
		}
		RearrangementType type = args.length == 3 ? RearrangementType.forName(args[2]) : RearrangementType.SPR;
		if (type == null) {
			System.err.println("Unrecognized rearrangement \"" + args[2] + "\"");
			return 2;
		}
		Topology topology = Topology.fromNewick(args[1]);
		String self = topology.toStructure();
		LinkedHashSet<String> seen = new LinkedHashSet<String>();
		for (Rearrangement r : topology.allType(type)) {
			PhyloTree t = r.toTree();
			if (!t.getStructure().equals(self) && seen.add(t.getStructure())) {
				out.println(t.getNewick());
			}
		}
		_LOG.info(seen.size() + " distinct " + type.getName() + " neighbors");
		return 0;
	}

	/*
	 * breadth-first expansion from the starting tree. no tree is explored once the landscape holds maxtrees trees,
	 * but the last neighborhood explored is added whole.
	 */
	public int explore(String[] args) throws TreeParseException, IOException {
		if (args.length != 5 || !StringUtils.isNumeric(args[3])) {
			System.err.println("arguments should be: newick SPR|NNI maxtrees outfile");
			return 2;
		}
		RearrangementType type = RearrangementType.forName(args[2]);
		if (type == null) {
			System.err.println("Unrecognized rearrangement \"" + args[2] + "\"");
			return 2;
		}
		int maxTrees = Integer.parseInt(args[3]);
		File outFile = new File(args[4]);

		Landscape landscape = new Landscape(null, null, new PhyloTree(args[1]));
		landscape.setOperator(type);
		LinkedList<Integer> queue = new LinkedList<Integer>();
		queue.add(landscape.getRoot());
		while (!queue.isEmpty() && landscape.size() < maxTrees) {
			queue.addAll(landscape.exploreTree(queue.removeFirst()));
		}
		LandscapeWriter.write(landscape, outFile.getName(), outFile);
		out.println(landscape);
		return 0;
	}

	public static void printHelp() {
		System.out.println("==========================");
		System.out.println("usage: treespace is run as:");
		System.out.println("");
		System.out.println("count ntaxa                               number of unrooted topologies");
		System.out.println("reroot newick                             canonical form of a tree");
		System.out.println("neighbors newick [SPR|NNI]                every tree one move away");
		System.out.println("explore newick SPR|NNI maxtrees outfile   build and save a landscape\n");
	}

	/**
	 * Run one command.
	 * @return 0 for success, 1 for a failed action, 2 for a poorly formed command
	 */
	public static int run(String[] args, PrintStream out) {
		if (args.length < 1) {
			printHelp();
			return 2;
		}
		String command = args[0];
		if (command.equals("help") || command.equals("-h") || command.equals("--help")) {
			printHelp();
			return 0;
		}
		int cmdReturnCode = 0;
		String action = "Command \"" + command + "\"";
		try {
			MainRunner mr = new MainRunner(out);
			if (command.equals("count")) {
				cmdReturnCode = mr.count(args);
			} else if (command.equals("reroot")) {
				cmdReturnCode = mr.reroot(args);
			} else if (command.equals("neighbors")) {
				cmdReturnCode = mr.neighbors(args);
			} else if (command.equals("explore")) {
				cmdReturnCode = mr.explore(args);
			} else {
				System.err.println("Unrecognized command \"" + command + "\"");
				cmdReturnCode = 2;
			}
		} catch (TreeParseException tpx) {
			tpx.reportFailedAction(System.err, action);
			cmdReturnCode = 1;
		} catch (RearrangementException rx) {
			rx.reportFailedAction(System.err, action);
			cmdReturnCode = 1;
		} catch (IOException iox) {
			System.err.println(action + " failed. " + iox.getMessage());
			cmdReturnCode = 1;
		}
		if (cmdReturnCode == 1) {
			_LOG.error(action + " failed");
		} else if (cmdReturnCode == 2) {
			printHelp();
		}
		return cmdReturnCode;
	}

	public static void main(String[] args) {
		System.exit(run(args, System.out));
	}
}
