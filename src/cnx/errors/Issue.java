package cnx.errors;

import cnx.Unreachable;
import cnx.formatters.IndentingWriter;
import cnx.formatters.IssueFormattingVisitor;
import cnx.trans.CnxTransException;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A problem found in the program export or its configuration. Issues are collected by an
 * {@link IssueContext} so that one run reports every problem it finds, and the message is
 * rendered on demand by {@link IssueFormattingVisitor}.
 */
public abstract class Issue extends CnxTransException {
	public Issue() {
		super("");
	}

	public Issue(String msg) {
		super(msg);
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
