package cnx.trans.passes.codegen;

import cnx.InternalCompilerError;
import cnx.formatters.CStatementFormattingVisitor;
import cnx.formatters.IndentingWriter;
import cnx.model.c.CStatement;

import java.io.IOException;
import java.io.StringWriter;
import java.util.*;

/**
 * Synchronization code with exactly one hole: a statement hole for code that runs protected,
 * or an expression hole for the operand of an atomic update. The enter fragment is the text
 * before the hole and the exit fragment the text after it.
 */
public final class SynchronizationTemplate {
	private final List<CStatement> statements;
	private final Set<RuntimeHelper> helpers;
	private final String enter;
	private final String exit;

	public SynchronizationTemplate(List<CStatement> statements, Set<RuntimeHelper> helpers) {
		this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
		EnumSet<RuntimeHelper> helperSet = EnumSet.noneOf(RuntimeHelper.class);
		helperSet.addAll(helpers);
		this.helpers = Collections.unmodifiableSet(helperSet);

		String text = format(this.statements);
		int hole = text.indexOf(CStatementFormattingVisitor.HOLE_MARKER);
		if (hole == -1 || text.indexOf(CStatementFormattingVisitor.HOLE_MARKER, hole + 1) != -1) {
			throw new InternalCompilerError("synchronization template must contain exactly one hole");
		}
		String before = text.substring(0, hole);
		String after = text.substring(hole + CStatementFormattingVisitor.HOLE_MARKER.length());
		if (before.isEmpty() || before.endsWith("\n")) {
			// statement hole on a line of its own
			this.enter = before.stripTrailing();
			this.exit = after.startsWith("\n") ? after.substring(1) : after;
		} else {
			this.enter = before;
			this.exit = after;
		}
	}

	private static String format(List<CStatement> statements) {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			boolean first = true;
			for (CStatement statement : statements) {
				if (!first) {
					out.newLine();
				}
				first = false;
				statement.accept(new CStatementFormattingVisitor(out));
			}
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}

	public List<CStatement> getStatements() {
		return statements;
	}

	public Set<RuntimeHelper> getHelpers() {
		return helpers;
	}

	public String getEnter() {
		return enter;
	}

	public String getExit() {
		return exit;
	}

	/**
	 * @return a new template running the given statements before this one
	 */
	public SynchronizationTemplate withPrefix(List<CStatement> prefix, Set<RuntimeHelper> prefixHelpers) {
		List<CStatement> combined = new ArrayList<>(prefix);
		combined.addAll(statements);
		Set<RuntimeHelper> combinedHelpers = new HashSet<>(helpers);
		combinedHelpers.addAll(prefixHelpers);
		return new SynchronizationTemplate(combined, combinedHelpers);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SynchronizationTemplate that = (SynchronizationTemplate) o;
		return statements.equals(that.statements) && helpers.equals(that.helpers);
	}

	@Override
	public int hashCode() {
		return Objects.hash(statements, helpers);
	}

	@Override
	public String toString() {
		return format(statements);
	}
}
