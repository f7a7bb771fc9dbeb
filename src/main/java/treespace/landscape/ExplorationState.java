package treespace.landscape;

/**
 * How far the neighborhood of a landscape node has been enumerated. A node only ever moves forward through these
 * states.
 */
public enum ExplorationState {
	UNEXPLORED,
	EXPLORING,
	EXPLORED
}
