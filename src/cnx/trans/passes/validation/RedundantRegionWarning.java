package cnx.trans.passes.validation;

import cnx.errors.Issue;
import cnx.errors.IssueVisitor;
import cnx.model.context.ExecutionContext;
import cnx.trans.passes.access.CriticalRegion;

public class RedundantRegionWarning extends Issue {
	private final CriticalRegion region;
	private final ExecutionContext context;
	private final int ceiling;

	public RedundantRegionWarning(CriticalRegion region, ExecutionContext context, int ceiling) {
		this.region = region;
		this.context = context;
		this.ceiling = ceiling;
	}

	public CriticalRegion getRegion() {
		return region;
	}

	public ExecutionContext getContext() {
		return context;
	}

	public int getCeiling() {
		return ceiling;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
