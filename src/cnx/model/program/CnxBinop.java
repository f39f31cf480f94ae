package cnx.model.program;

import cnx.util.SourceLocation;

import java.util.Objects;

public class CnxBinop extends CnxExpression {
	private final String operation;
	private final CnxExpression lhs;
	private final CnxExpression rhs;

	public CnxBinop(SourceLocation location, String operation, CnxExpression lhs, CnxExpression rhs) {
		super(location);
		this.operation = operation;
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public String getOperation() {
		return operation;
	}

	public CnxExpression getLHS() {
		return lhs;
	}

	public CnxExpression getRHS() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(CnxExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operation, lhs, rhs);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		CnxBinop other = (CnxBinop) obj;
		return operation.equals(other.operation) && lhs.equals(other.lhs) && rhs.equals(other.rhs);
	}
}
