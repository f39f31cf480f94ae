package cnx.model.c;

import java.util.Objects;

public class CExpressionStatement extends CStatement {
	private final CExpression expression;

	public CExpressionStatement(CExpression expression) {
		this.expression = expression;
	}

	public CExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CExpressionStatement expressionStatement = (CExpressionStatement) o;
		return Objects.equals(expression, expressionStatement.expression);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression);
	}
}
