package cnx.model.program;

import cnx.util.SourceLocation;

import java.util.List;

public class CnxBlock extends CnxStatement {
	private final List<CnxStatement> body;

	public CnxBlock(SourceLocation location, List<CnxStatement> body) {
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
		return body.equals(((CnxBlock) obj).body);
	}
}
