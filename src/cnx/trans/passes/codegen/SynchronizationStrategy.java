package cnx.trans.passes.codegen;

public enum SynchronizationStrategy {
	LOCK_FREE_RETRY("lock-free-retry"),
	SELECTIVE_MASK("selective-mask"),
	GLOBAL_DISABLE("global-disable"),
	NONE("none");

	private final String reportName;

	SynchronizationStrategy(String reportName) {
		this.reportName = reportName;
	}

	public String getReportName() {
		return reportName;
	}
}
