package cnx.model.program;

public abstract class CnxNodeVisitor<T, E extends Throwable> {
	public abstract T visit(CnxStatement statement) throws E;
	public abstract T visit(CnxExpression expression) throws E;
}
