package cnx.model.program;

import cnx.Unreachable;
import cnx.formatters.CnxNodeFormattingVisitor;
import cnx.formatters.IndentingWriter;
import cnx.scope.UID;
import cnx.util.SourceLocatable;
import cnx.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

public abstract class CnxNode extends SourceLocatable {

	private final SourceLocation location;
	private final UID uid;

	public CnxNode(SourceLocation location) {
		this.location = location;
		this.uid = new UID();
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public UID getUID() {
		return uid;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	public abstract <T, E extends Throwable> T accept(CnxNodeVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new CnxNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
