package cnx.model.program;

import cnx.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class CnxWhile extends CnxStatement {
	private final CnxExpression condition;
	private final List<CnxStatement> body;

	public CnxWhile(SourceLocation location, CnxExpression condition, List<CnxStatement> body) {
		super(location);
		this.condition = condition;
		this.body = body;
	}

	public CnxExpression getCondition() {
		return condition;
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
		return Objects.hash(condition, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		CnxWhile other = (CnxWhile) obj;
		return condition.equals(other.condition) && body.equals(other.body);
	}
}
