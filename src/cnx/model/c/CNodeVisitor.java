package cnx.model.c;

public abstract class CNodeVisitor<T, E extends Throwable> {
	public abstract T visit(CStatement statement) throws E;
	public abstract T visit(CExpression expression) throws E;
}
