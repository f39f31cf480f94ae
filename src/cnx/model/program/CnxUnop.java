package cnx.model.program;

import cnx.util.SourceLocation;

import java.util.Objects;

public class CnxUnop extends CnxExpression {
	private final String operation;
	private final CnxExpression operand;

	public CnxUnop(SourceLocation location, String operation, CnxExpression operand) {
		super(location);
		this.operation = operation;
		this.operand = operand;
	}

	public String getOperation() {
		return operation;
	}

	public CnxExpression getOperand() {
		return operand;
	}

	@Override
	public <T, E extends Throwable> T accept(CnxExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operation, operand);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		CnxUnop other = (CnxUnop) obj;
		return operation.equals(other.operation) && operand.equals(other.operand);
	}
}
