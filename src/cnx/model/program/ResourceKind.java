package cnx.model.program;

public enum ResourceKind {
	/**
	 * Declared {@code atomic}: single loads, stores and compound assignments are indivisible.
	 */
	ATOMIC,
	/**
	 * Protected only by the critical regions that enclose its accesses.
	 */
	REGION_SCOPED,
}
