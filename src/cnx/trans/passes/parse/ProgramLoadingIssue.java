package cnx.trans.passes.parse;

import cnx.errors.Issue;
import cnx.errors.IssueVisitor;
import cnx.util.SourceLocation;

public class ProgramLoadingIssue extends Issue {
	private final SourceLocation location;
	private final String reason;

	public ProgramLoadingIssue(SourceLocation location, String reason) {
		this.location = location;
		this.reason = reason;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
