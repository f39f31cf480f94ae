package cnx.model.c;

public abstract class CStatementVisitor<T, E extends Throwable> {
	public abstract T visit(CVariableDeclaration variableDeclaration) throws E;
	public abstract T visit(CExpressionStatement expressionStatement) throws E;
	public abstract T visit(CIf cIf) throws E;
	public abstract T visit(CDoWhile doWhile) throws E;
	public abstract T visit(CBreak cBreak) throws E;
	public abstract T visit(CStatementHole statementHole) throws E;
}
