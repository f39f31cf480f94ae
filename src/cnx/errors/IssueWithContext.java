package cnx.errors;

/**
 * An issue together with where the analysis was when it found it, e.g. the function whose
 * body was being walked.
 */
public class IssueWithContext extends Issue {
	private final Context context;
	private final Issue issue;

	public IssueWithContext(Issue issue, Context context) {
		this.issue = issue;
		this.context = context;
	}

	public Issue getIssue() {
		return issue;
	}

	public Context getContext() {
		return context;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
