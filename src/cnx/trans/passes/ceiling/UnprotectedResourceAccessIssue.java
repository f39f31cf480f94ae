package cnx.trans.passes.ceiling;

import cnx.errors.Issue;
import cnx.errors.IssueVisitor;
import cnx.trans.passes.access.AccessSite;

public class UnprotectedResourceAccessIssue extends Issue {
	private final AccessSite site;
	private final ResourceCeiling resourceCeiling;

	public UnprotectedResourceAccessIssue(AccessSite site, ResourceCeiling resourceCeiling) {
		this.site = site;
		this.resourceCeiling = resourceCeiling;
	}

	public AccessSite getSite() {
		return site;
	}

	public ResourceCeiling getResourceCeiling() {
		return resourceCeiling;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
