package cnx.model.program;

public abstract class CnxExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(CnxVariableReference variableReference) throws E;
	public abstract T visit(CnxLiteral literal) throws E;
	public abstract T visit(CnxBinop binop) throws E;
	public abstract T visit(CnxUnop unop) throws E;
	public abstract T visit(CnxCall call) throws E;
	public abstract T visit(CnxIndirectCall indirectCall) throws E;
}
