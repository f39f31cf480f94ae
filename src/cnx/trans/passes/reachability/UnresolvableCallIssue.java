package cnx.trans.passes.reachability;

import cnx.errors.Issue;
import cnx.errors.IssueVisitor;

public class UnresolvableCallIssue extends Issue {
	private final CallSite callSite;

	public UnresolvableCallIssue(CallSite callSite) {
		this.callSite = callSite;
	}

	public CallSite getCallSite() {
		return callSite;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
