package cnx.model.c;

import java.util.Objects;

public class CParenthesized extends CExpression {
	private final CExpression inner;

	public CParenthesized(CExpression inner) {
		this.inner = inner;
	}

	public CExpression getInner() {
		return inner;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CParenthesized parenthesized = (CParenthesized) o;
		return Objects.equals(inner, parenthesized.inner);
	}

	@Override
	public int hashCode() {
		return Objects.hash(inner);
	}
}
