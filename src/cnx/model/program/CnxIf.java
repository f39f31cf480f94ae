package cnx.model.program;

import cnx.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class CnxIf extends CnxStatement {
	private final CnxExpression condition;
	private final List<CnxStatement> yes;
	private final List<CnxStatement> no;

	public CnxIf(SourceLocation location, CnxExpression condition, List<CnxStatement> yes, List<CnxStatement> no) {
		super(location);
		this.condition = condition;
		this.yes = yes;
		this.no = no;
	}

	public CnxExpression getCondition() {
		return condition;
	}

	public List<CnxStatement> getYes() {
		return yes;
	}

	public List<CnxStatement> getNo() {
		return no;
	}

	@Override
	public <T, E extends Throwable> T accept(CnxStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, yes, no);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		CnxIf other = (CnxIf) obj;
		return condition.equals(other.condition) && yes.equals(other.yes) && no.equals(other.no);
	}
}
