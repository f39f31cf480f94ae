package cnx.errors;

/**
 * Where passes report what they find. Errors are structural and stop the pipeline once the
 * current stage is done; warnings are advisory and never stop it.
 */
public abstract class IssueContext {

	public abstract void error(Issue err);

	public abstract void warning(Issue warning);

	public abstract boolean hasErrors();

	public IssueContext withContext(Context context) {
		return new NestedIssueContext(this, context);
	}
}
