package cnx.model.program;

import cnx.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class CnxDoWhile extends CnxStatement {
	private final List<CnxStatement> body;
	private final CnxExpression condition;

	public CnxDoWhile(SourceLocation location, List<CnxStatement> body, CnxExpression condition) {
		super(location);
		this.body = body;
		this.condition = condition;
	}

	public List<CnxStatement> getBody() {
		return body;
	}

	public CnxExpression getCondition() {
		return condition;
	}

	@Override
	public <T, E extends Throwable> T accept(CnxStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(body, condition);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		CnxDoWhile other = (CnxDoWhile) obj;
		return condition.equals(other.condition) && body.equals(other.body);
	}
}
