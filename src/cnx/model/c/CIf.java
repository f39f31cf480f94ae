package cnx.model.c;

import java.util.List;
import java.util.Objects;

public class CIf extends CStatement {
	private final CExpression condition;
	private final List<CStatement> then;

	public CIf(CExpression condition, List<CStatement> then) {
		this.condition = condition;
		this.then = then;
	}

	public CExpression getCondition() {
		return condition;
	}

	public List<CStatement> getThen() {
		return then;
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CIf cIf = (CIf) o;
		return Objects.equals(condition, cIf.condition) &&
				Objects.equals(then, cIf.then);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, then);
	}
}
