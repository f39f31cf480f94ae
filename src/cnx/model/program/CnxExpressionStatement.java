package cnx.model.program;

import cnx.util.SourceLocation;

public class CnxExpressionStatement extends CnxStatement {
	private final CnxExpression expression;

	public CnxExpressionStatement(SourceLocation location, CnxExpression expression) {
		super(location);
		this.expression = expression;
	}

	public CnxExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(CnxStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return expression.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		return expression.equals(((CnxExpressionStatement) obj).expression);
	}
}
