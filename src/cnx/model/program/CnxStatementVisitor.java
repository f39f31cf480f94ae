package cnx.model.program;

public abstract class CnxStatementVisitor<T, E extends Throwable> {
	public abstract T visit(CnxAssignment assignment) throws E;
	public abstract T visit(CnxExpressionStatement expressionStatement) throws E;
	public abstract T visit(CnxLocalDeclaration localDeclaration) throws E;
	public abstract T visit(CnxCriticalBlock criticalBlock) throws E;
	public abstract T visit(CnxBlock block) throws E;
	public abstract T visit(CnxIf cnxIf) throws E;
	public abstract T visit(CnxWhile cnxWhile) throws E;
	public abstract T visit(CnxDoWhile doWhile) throws E;
	public abstract T visit(CnxFor cnxFor) throws E;
	public abstract T visit(CnxReturn cnxReturn) throws E;
	public abstract T visit(CnxBreak cnxBreak) throws E;
	public abstract T visit(CnxContinue cnxContinue) throws E;
}
