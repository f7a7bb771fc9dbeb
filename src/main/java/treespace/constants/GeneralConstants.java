package treespace.constants;

/**
 * A general-purpose container for values that do not change but do not fit into a more specific enum. The data
 * objects themselves are stored in the `value` parameter, and the type is indicated by the type stored in `type`.
 */
public enum GeneralConstants {

	// weight given to a landscape edge when none is specified
	DEFAULT_EDGE_WEIGHT (Double.class, 0.0),

	// length of the root branch that carries everything but the anchor leaf
	FAKE_BRANCH_LENGTH (Double.class, 0.0),

	// returned by counting queries that make no sense for the current operator
	LS_NOT_DEFINED (Integer.class, -1),

	// written into and checked against persisted landscape files
	LANDSCAPE_FORMAT_VERSION (String.class, "1.0");

	public final Class<?> type;
	public final Object value;

	GeneralConstants(Class<?> type, Object value) {
		this.type = type;
		this.value = value;
	}
}
