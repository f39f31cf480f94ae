package cnx.errors;

public class NestedIssueContext extends IssueContext {

	private final IssueContext parent;
	private final Context context;

	public NestedIssueContext(IssueContext parent, Context context) {
		this.parent = parent;
		this.context = context;
	}

	@Override
	public void error(Issue err) {
		parent.error(err.withContext(context));
	}

	@Override
	public void warning(Issue warning) {
		parent.warning(warning.withContext(context));
	}

	@Override
	public boolean hasErrors() {
		return parent.hasErrors();
	}

}
