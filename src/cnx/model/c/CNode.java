package cnx.model.c;

import cnx.formatters.CNodeFormattingVisitor;
import cnx.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

/**
 * The small subset of C needed for synchronization code around protected statements.
 */
public abstract class CNode {

	public abstract <T, E extends Throwable> T accept(CNodeVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new CNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}

}
