package cnx.model.c;

import java.util.Objects;

public class CAddressOf extends CExpression {
	private final CExpression operand;

	public CAddressOf(CExpression operand) {
		this.operand = operand;
	}

	public CExpression getOperand() {
		return operand;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CAddressOf addressOf = (CAddressOf) o;
		return Objects.equals(operand, addressOf.operand);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operand);
	}
}
