package cnx.trans.passes.ceiling;

import cnx.errors.Issue;
import cnx.errors.IssueVisitor;
import cnx.trans.passes.access.CriticalRegion;

import java.util.Set;

public class OpaqueCallConservativeCeilingWarning extends Issue {
	private final CriticalRegion region;
	private final Set<String> callees;
	private final int ceiling;

	public OpaqueCallConservativeCeilingWarning(CriticalRegion region, Set<String> callees, int ceiling) {
		this.region = region;
		this.callees = callees;
		this.ceiling = ceiling;
	}

	public CriticalRegion getRegion() {
		return region;
	}

	public Set<String> getCallees() {
		return callees;
	}

	public int getCeiling() {
		return ceiling;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
