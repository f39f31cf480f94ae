package cnx.trans.passes.reachability;

/**
 * What to do with a call whose target cannot be resolved statically.
 */
public enum UnresolvedCallPolicy {
	/**
	 * Every indirect call is a structural error.
	 */
	REJECT("reject"),
	/**
	 * Every function whose address is taken may run in every context.
	 */
	ASSUME_ALL_CONTEXTS("assume_all_contexts");

	private final String configName;

	UnresolvedCallPolicy(String configName) {
		this.configName = configName;
	}

	public String getConfigName() {
		return configName;
	}

	public static UnresolvedCallPolicy fromConfigName(String name) {
		for (UnresolvedCallPolicy policy : values()) {
			if (policy.configName.equals(name)) {
				return policy;
			}
		}
		throw new IllegalArgumentException("unknown unresolved call policy " + name);
	}
}
