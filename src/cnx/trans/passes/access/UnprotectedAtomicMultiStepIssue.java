package cnx.trans.passes.access;

import cnx.errors.Issue;
import cnx.errors.IssueVisitor;

public class UnprotectedAtomicMultiStepIssue extends Issue {
	private final MultiStepCandidate candidate;

	public UnprotectedAtomicMultiStepIssue(MultiStepCandidate candidate) {
		this.candidate = candidate;
	}

	public MultiStepCandidate getCandidate() {
		return candidate;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
