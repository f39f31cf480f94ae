package cnx.model.c;

import java.util.Objects;

public class CBinop extends CExpression {
	private final String operation;
	private final CExpression lhs;
	private final CExpression rhs;

	public CBinop(String operation, CExpression lhs, CExpression rhs) {
		this.operation = operation;
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public String getOperation() {
		return operation;
	}

	public CExpression getLhs() {
		return lhs;
	}

	public CExpression getRhs() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CBinop binop = (CBinop) o;
		return Objects.equals(operation, binop.operation) &&
				Objects.equals(lhs, binop.lhs) &&
				Objects.equals(rhs, binop.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operation, lhs, rhs);
	}
}
