package cnx.trans.passes.validation;

import cnx.model.program.*;
import cnx.trans.passes.access.AccessCollection;
import cnx.trans.passes.access.CriticalRegion;

import java.util.List;
import java.util.function.Consumer;

/**
 * Finds statements that leave a critical region other than by falling off its end. The loop
 * depth counts loops opened inside the current region; a break or continue at depth 0 targets
 * a loop outside it.
 */
public class CnxStatementEarlyExitVisitor extends CnxStatementVisitor<Void, RuntimeException> {
	private final AccessCollection collection;
	private final CriticalRegion region;
	private final int loopDepth;
	private final Consumer<EarlyExitInCriticalRegionIssue> report;

	public CnxStatementEarlyExitVisitor(AccessCollection collection, CriticalRegion region, int loopDepth,
	                                    Consumer<EarlyExitInCriticalRegionIssue> report) {
		this.collection = collection;
		this.region = region;
		this.loopDepth = loopDepth;
		this.report = report;
	}

	private void visitBody(List<CnxStatement> body, CnxStatementVisitor<Void, RuntimeException> visitor) {
		body.forEach(s -> s.accept(visitor));
	}

	private CnxStatementEarlyExitVisitor insideLoop() {
		return new CnxStatementEarlyExitVisitor(collection, region, loopDepth + 1, report);
	}

	@Override
	public Void visit(CnxAssignment assignment) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(CnxExpressionStatement expressionStatement) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(CnxLocalDeclaration localDeclaration) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(CnxCriticalBlock criticalBlock) throws RuntimeException {
		CriticalRegion inner = collection.findRegion(criticalBlock).orElse(region);
		visitBody(criticalBlock.getBody(), new CnxStatementEarlyExitVisitor(collection, inner, 0, report));
		return null;
	}

	@Override
	public Void visit(CnxBlock block) throws RuntimeException {
		visitBody(block.getBody(), this);
		return null;
	}

	@Override
	public Void visit(CnxIf cnxIf) throws RuntimeException {
		visitBody(cnxIf.getYes(), this);
		visitBody(cnxIf.getNo(), this);
		return null;
	}

	@Override
	public Void visit(CnxWhile cnxWhile) throws RuntimeException {
		visitBody(cnxWhile.getBody(), insideLoop());
		return null;
	}

	@Override
	public Void visit(CnxDoWhile doWhile) throws RuntimeException {
		visitBody(doWhile.getBody(), insideLoop());
		return null;
	}

	@Override
	public Void visit(CnxFor cnxFor) throws RuntimeException {
		visitBody(cnxFor.getBody(), insideLoop());
		return null;
	}

	@Override
	public Void visit(CnxReturn cnxReturn) throws RuntimeException {
		if (region != null) {
			report.accept(new EarlyExitInCriticalRegionIssue(region, cnxReturn, "return"));
		}
		return null;
	}

	@Override
	public Void visit(CnxBreak cnxBreak) throws RuntimeException {
		if (region != null && loopDepth == 0) {
			report.accept(new EarlyExitInCriticalRegionIssue(region, cnxBreak, "break"));
		}
		return null;
	}

	@Override
	public Void visit(CnxContinue cnxContinue) throws RuntimeException {
		if (region != null && loopDepth == 0) {
			report.accept(new EarlyExitInCriticalRegionIssue(region, cnxContinue, "continue"));
		}
		return null;
	}
}
