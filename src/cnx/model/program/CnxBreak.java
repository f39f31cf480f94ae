package cnx.model.program;

import cnx.util.SourceLocation;

public class CnxBreak extends CnxStatement {
	public CnxBreak(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(CnxStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 0;
	}

	@Override
	public boolean equals(Object other) {
		return other instanceof CnxBreak;
	}
}
