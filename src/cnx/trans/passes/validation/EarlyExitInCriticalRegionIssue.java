package cnx.trans.passes.validation;

import cnx.errors.Issue;
import cnx.errors.IssueVisitor;
import cnx.model.program.CnxStatement;
import cnx.trans.passes.access.CriticalRegion;

public class EarlyExitInCriticalRegionIssue extends Issue {
	private final CriticalRegion region;
	private final CnxStatement exit;
	private final String keyword;

	public EarlyExitInCriticalRegionIssue(CriticalRegion region, CnxStatement exit, String keyword) {
		this.region = region;
		this.exit = exit;
		this.keyword = keyword;
	}

	public CriticalRegion getRegion() {
		return region;
	}

	public CnxStatement getExit() {
		return exit;
	}

	/**
	 * @return "return", "break" or "continue"
	 */
	public String getKeyword() {
		return keyword;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
