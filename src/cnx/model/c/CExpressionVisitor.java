package cnx.model.c;

public abstract class CExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(CVariable variable) throws E;
	public abstract T visit(CIntLiteral intLiteral) throws E;
	public abstract T visit(CStringLiteral stringLiteral) throws E;
	public abstract T visit(CCall call) throws E;
	public abstract T visit(CBinop binop) throws E;
	public abstract T visit(CAddressOf addressOf) throws E;
	public abstract T visit(CParenthesized parenthesized) throws E;
	public abstract T visit(CExpressionHole expressionHole) throws E;
}
