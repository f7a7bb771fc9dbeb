package treespace.rearrangement;

/**
 * The kinds of topology rearrangement. Only SPR and NNI moves can be enumerated.
 */
public enum RearrangementType {

	SPR (1, "SPR"),
	NNI (2, "NNI"),
	TBR (3, "TBR");

	public final int code;
	public final String label;

	RearrangementType(int code, String label) {
		this.code = code;
		this.label = label;
	}

	public String getName() {
		return label;
	}

	/**
	 * @return the type with the given name, ignoring case, or null
	 */
	public static RearrangementType forName(String name) {
		for (RearrangementType t : values()) {
			if (t.label.equalsIgnoreCase(name)) {
				return t;
			}
		}
		return null;
	}
}
