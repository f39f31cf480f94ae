package cnx.trans.passes.validation;

import cnx.errors.Issue;
import cnx.errors.IssueVisitor;
import cnx.trans.passes.access.CriticalRegion;

public class NestedRegionWarning extends Issue {
	private final CriticalRegion inner;
	private final CriticalRegion outer;
	private final boolean throughCall;

	public NestedRegionWarning(CriticalRegion inner, CriticalRegion outer, boolean throughCall) {
		this.inner = inner;
		this.outer = outer;
		this.throughCall = throughCall;
	}

	public CriticalRegion getInner() {
		return inner;
	}

	public CriticalRegion getOuter() {
		return outer;
	}

	/**
	 * @return true when the inner region is in a helper called from inside the outer one
	 */
	public boolean isThroughCall() {
		return throughCall;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
