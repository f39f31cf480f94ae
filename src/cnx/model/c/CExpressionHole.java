package cnx.model.c;

/**
 * Where the operand of an atomic read-modify-write goes.
 */
public class CExpressionHole extends CExpression {
	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return o != null && getClass() == o.getClass();
	}

	@Override
	public int hashCode() {
		return CExpressionHole.class.hashCode();
	}
}
