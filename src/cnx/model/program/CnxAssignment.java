package cnx.model.program;

import cnx.util.SourceLocation;

import java.util.Objects;

public class CnxAssignment extends CnxStatement {
	private final String target;
	private final AssignmentOperator operator;
	private final CnxExpression value;

	public CnxAssignment(SourceLocation location, String target, AssignmentOperator operator, CnxExpression value) {
		super(location);
		this.target = target;
		this.operator = operator;
		this.value = value;
	}

	public String getTarget() {
		return target;
	}

	public AssignmentOperator getOperator() {
		return operator;
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
		return Objects.hash(target, operator, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		CnxAssignment other = (CnxAssignment) obj;
		return target.equals(other.target) && operator == other.operator && value.equals(other.value);
	}
}
