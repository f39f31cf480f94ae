package cnx.trans.passes.reachability;

import cnx.model.program.*;

import java.util.function.Consumer;

public class CnxStatementCallSiteVisitor extends CnxStatementVisitor<Void, RuntimeException> {
	private final String caller;
	private final CnxCriticalBlock enclosingBlock;
	private final Consumer<CallSite> captureCallSite;
	private final CnxExpressionCallSiteVisitor expressionVisitor;

	public CnxStatementCallSiteVisitor(String caller, CnxCriticalBlock enclosingBlock,
	                                   Consumer<CallSite> captureCallSite) {
		this.caller = caller;
		this.enclosingBlock = enclosingBlock;
		this.captureCallSite = captureCallSite;
		this.expressionVisitor = new CnxExpressionCallSiteVisitor(caller, enclosingBlock, captureCallSite);
	}

	private void visitExpression(CnxExpression expression) {
		if (expression != null) {
			expression.accept(expressionVisitor);
		}
	}

	@Override
	public Void visit(CnxAssignment assignment) throws RuntimeException {
		visitExpression(assignment.getValue());
		return null;
	}

	@Override
	public Void visit(CnxExpressionStatement expressionStatement) throws RuntimeException {
		visitExpression(expressionStatement.getExpression());
		return null;
	}

	@Override
	public Void visit(CnxLocalDeclaration localDeclaration) throws RuntimeException {
		visitExpression(localDeclaration.getInitializer());
		return null;
	}

	@Override
	public Void visit(CnxCriticalBlock criticalBlock) throws RuntimeException {
		CnxStatementCallSiteVisitor inner = new CnxStatementCallSiteVisitor(caller, criticalBlock, captureCallSite);
		criticalBlock.getBody().forEach(s -> s.accept(inner));
		return null;
	}

	@Override
	public Void visit(CnxBlock block) throws RuntimeException {
		block.getBody().forEach(s -> s.accept(this));
		return null;
	}

	@Override
	public Void visit(CnxIf cnxIf) throws RuntimeException {
		visitExpression(cnxIf.getCondition());
		cnxIf.getYes().forEach(s -> s.accept(this));
		cnxIf.getNo().forEach(s -> s.accept(this));
		return null;
	}

	@Override
	public Void visit(CnxWhile cnxWhile) throws RuntimeException {
		visitExpression(cnxWhile.getCondition());
		cnxWhile.getBody().forEach(s -> s.accept(this));
		return null;
	}

	@Override
	public Void visit(CnxDoWhile doWhile) throws RuntimeException {
		doWhile.getBody().forEach(s -> s.accept(this));
		visitExpression(doWhile.getCondition());
		return null;
	}

	@Override
	public Void visit(CnxFor cnxFor) throws RuntimeException {
		if (cnxFor.getInit() != null) {
			cnxFor.getInit().accept(this);
		}
		visitExpression(cnxFor.getCondition());
		if (cnxFor.getUpdate() != null) {
			cnxFor.getUpdate().accept(this);
		}
		cnxFor.getBody().forEach(s -> s.accept(this));
		return null;
	}

	@Override
	public Void visit(CnxReturn cnxReturn) throws RuntimeException {
		visitExpression(cnxReturn.getValue());
		return null;
	}

	@Override
	public Void visit(CnxBreak cnxBreak) throws RuntimeException {
		// nothing to do
		return null;
	}

	@Override
	public Void visit(CnxContinue cnxContinue) throws RuntimeException {
		// nothing to do
		return null;
	}
}
