package cnx.model.program;

import cnx.util.SourceLocation;

import java.util.Objects;

public class CnxReturn extends CnxStatement {
	private final CnxExpression value;

	/**
	 * @param value may be null for a bare return
	 */
	public CnxReturn(SourceLocation location, CnxExpression value) {
		super(location);
		this.value = value;
	}

	public CnxExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(CnxStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		return Objects.equals(value, ((CnxReturn) obj).value);
	}
}
