package cnx.model.program;

import cnx.util.SourceLocation;

import java.util.List;

/**
 * A lexical {@code critical { ... }} block. Its body runs with interrupts masked up to the
 * ceiling computed for it.
 */
public class CnxCriticalBlock extends CnxStatement {
	private final List<CnxStatement> body;

	public CnxCriticalBlock(SourceLocation location, List<CnxStatement> body) {
		super(location);
		this.body = body;
	}

	public List<CnxStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(CnxStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return body.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		return body.equals(((CnxCriticalBlock) obj).body);
	}
}
