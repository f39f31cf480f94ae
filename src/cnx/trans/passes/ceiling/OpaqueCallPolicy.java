package cnx.trans.passes.ceiling;

/**
 * How a call inside a critical block to a function that may touch resources affects the
 * block's ceiling.
 */
public enum OpaqueCallPolicy {
	/**
	 * Any such call raises the ceiling to the highest interrupt priority of the program.
	 */
	CONSERVATIVE("conservative"),
	/**
	 * Calls to defined functions whose whole call tree is visible contribute the resources that
	 * tree touches. External and indirect calls still raise the ceiling to the maximum.
	 */
	FOOTPRINT("footprint");

	private final String configName;

	OpaqueCallPolicy(String configName) {
		this.configName = configName;
	}

	public String getConfigName() {
		return configName;
	}

	public static OpaqueCallPolicy fromConfigName(String name) {
		for (OpaqueCallPolicy policy : values()) {
			if (policy.configName.equals(name)) {
				return policy;
			}
		}
		throw new IllegalArgumentException("unknown opaque call policy " + name);
	}
}
