package cnx.model.c;

public abstract class CExpression extends CNode {

	public abstract <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(CNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
