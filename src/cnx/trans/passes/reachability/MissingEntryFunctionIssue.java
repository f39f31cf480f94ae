package cnx.trans.passes.reachability;

import cnx.errors.Issue;
import cnx.errors.IssueVisitor;
import cnx.model.context.ExecutionContext;

public class MissingEntryFunctionIssue extends Issue {
	private final ExecutionContext context;

	public MissingEntryFunctionIssue(ExecutionContext context) {
		this.context = context;
	}

	public ExecutionContext getContext() {
		return context;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
