package cnx.errors;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import cnx.formatters.IndentingWriter;
import cnx.formatters.IssueFormattingVisitor;

public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> errors;
	private final List<Issue> warnings;

	public TopLevelIssueContext() {
		this.errors = new ArrayList<>();
		this.warnings = new ArrayList<>();
	}

	@Override
	public void error(Issue err) {
		errors.add(err);
	}

	@Override
	public void warning(Issue warning) {
		warnings.add(warning);
	}

	@Override
	public boolean hasErrors() {
		return !errors.isEmpty();
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(errors);
	}

	public List<Issue> getWarnings() {
		return Collections.unmodifiableList(warnings);
	}

	public void format(IndentingWriter out) throws IOException {
		out.write("Detected ");
		out.write(Integer.toString(errors.size()));
		out.write(" issue(s):");
		for (Issue e : errors) {
			out.newLine();
			e.accept(new IssueFormattingVisitor(out));
		}
		if (!warnings.isEmpty()) {
			out.newLine();
			formatWarnings(out);
		}
	}

	public void formatWarnings(IndentingWriter out) throws IOException {
		out.write(Integer.toString(warnings.size()));
		out.write(" warning(s):");
		for (Issue w : warnings) {
			out.newLine();
			w.accept(new IssueFormattingVisitor(out));
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			format(out);
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}

	public String formatWarnings() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			formatWarnings(out);
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}
}
