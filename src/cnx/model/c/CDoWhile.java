package cnx.model.c;

import java.util.List;
import java.util.Objects;

public class CDoWhile extends CStatement {
	private final List<CStatement> body;
	private final CExpression condition;

	public CDoWhile(List<CStatement> body, CExpression condition) {
		this.body = body;
		this.condition = condition;
	}

	public List<CStatement> getBody() {
		return body;
	}

	public CExpression getCondition() {
		return condition;
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CDoWhile doWhile = (CDoWhile) o;
		return Objects.equals(body, doWhile.body) &&
				Objects.equals(condition, doWhile.condition);
	}

	@Override
	public int hashCode() {
		return Objects.hash(body, condition);
	}
}
