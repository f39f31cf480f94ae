package cnx.trans.passes.access;

import cnx.model.program.*;

import java.util.*;

public class CnxStatementAccessVisitor extends CnxStatementVisitor<Void, RuntimeException> {
	private final FunctionAccessCollector collector;
	private final CriticalRegion region;
	private final Set<String> shadowed;

	CnxStatementAccessVisitor(FunctionAccessCollector collector, CriticalRegion region, Set<String> shadowed) {
		this.collector = collector;
		this.region = region;
		this.shadowed = shadowed;
	}

	private CnxStatementAccessVisitor nestedScope(CriticalRegion innerRegion) {
		return new CnxStatementAccessVisitor(collector, innerRegion, new HashSet<>(shadowed));
	}

	private void visitBody(List<CnxStatement> body, CriticalRegion innerRegion) {
		CnxStatementAccessVisitor inner = nestedScope(innerRegion);
		body.forEach(s -> s.accept(inner));
	}

	private List<CnxResourceDeclaration> reads(CnxStatement statement, CnxExpression expression) {
		return reads(statement, expression, new HashSet<>());
	}

	// sources also receives the resources behind every local the expression reads
	private List<CnxResourceDeclaration> reads(CnxStatement statement, CnxExpression expression,
	                                           Set<CnxResourceDeclaration> sources) {
		List<CnxResourceDeclaration> result = new ArrayList<>();
		if (expression != null) {
			expression.accept(new CnxExpressionAccessVisitor(collector.getProgram(), shadowed, (resource, ref) -> {
				collector.addSite(resource, AccessOperation.READ, region, statement, ref, null);
				result.add(resource);
			}, local -> sources.addAll(collector.getLocalSources(local))));
		}
		sources.addAll(result);
		return result;
	}

	@Override
	public Void visit(CnxAssignment assignment) throws RuntimeException {
		Set<CnxResourceDeclaration> sources = new HashSet<>();
		List<CnxResourceDeclaration> reads = reads(assignment, assignment.getValue(), sources);
		Optional<CnxResourceDeclaration> target = collector.resolve(assignment.getTarget(), shadowed);
		if (!target.isPresent()) {
			if (shadowed.contains(assignment.getTarget())) {
				collector.addLocalSources(assignment.getTarget(), sources);
			}
			if (region == null) {
				checkRepeatedReads(assignment, reads);
			}
			return null;
		}
		AssignmentOperator operator = assignment.getOperator();
		collector.addSite(target.get(),
				operator.isCompound() ? AccessOperation.READ_MODIFY_WRITE : AccessOperation.WRITE,
				region, assignment, assignment, operator);
		if (region == null) {
			checkMultiStep(assignment, target.get(), reads, sources);
		}
		return null;
	}

	private void checkMultiStep(CnxAssignment assignment, CnxResourceDeclaration target,
	                            List<CnxResourceDeclaration> reads, Set<CnxResourceDeclaration> sources) {
		boolean readsTarget = reads.contains(target);
		// the value was computed from an earlier read of the target, e.g. t <- x; x <- t + 1
		boolean dependsOnTarget = sources.contains(target);
		if (assignment.getOperator().isCompound()) {
			if (!target.isAtomic() || dependsOnTarget) {
				collector.addMultiStepCandidate(target, assignment, null);
			}
			return;
		}
		if (readsTarget) {
			collector.addMultiStepCandidate(target, assignment, suggestCompoundForm(assignment, target));
			return;
		}
		if (dependsOnTarget) {
			collector.addMultiStepCandidate(target, assignment, null);
			return;
		}
		checkRepeatedReads(assignment, reads);
	}

	// reading one resource twice in a statement may observe two different values
	private void checkRepeatedReads(CnxStatement statement, List<CnxResourceDeclaration> reads) {
		Set<CnxResourceDeclaration> seen = new HashSet<>();
		Set<CnxResourceDeclaration> reported = new HashSet<>();
		for (CnxResourceDeclaration read : reads) {
			if (!seen.add(read) && reported.add(read)) {
				collector.addMultiStepCandidate(read, statement, null);
			}
		}
	}

	// x <- x + e becomes x +<- e when x is atomic and e does not read x
	private String suggestCompoundForm(CnxAssignment assignment, CnxResourceDeclaration target) {
		if (!target.isAtomic() || !(assignment.getValue() instanceof CnxBinop)) {
			return null;
		}
		CnxBinop binop = (CnxBinop) assignment.getValue();
		if (!(binop.getLHS() instanceof CnxVariableReference) ||
				!((CnxVariableReference) binop.getLHS()).getName().equals(target.getName())) {
			return null;
		}
		List<CnxResourceDeclaration> rhsReads = new ArrayList<>();
		binop.getRHS().accept(new CnxExpressionAccessVisitor(collector.getProgram(), shadowed,
				(resource, ref) -> rhsReads.add(resource)));
		if (rhsReads.contains(target)) {
			return null;
		}
		return AssignmentOperator.fromBinaryOperator(binop.getOperation())
				.map(op -> new CnxAssignment(assignment.getLocation(), target.getName(), op, binop.getRHS()).toString())
				.orElse(null);
	}

	@Override
	public Void visit(CnxExpressionStatement expressionStatement) throws RuntimeException {
		reads(expressionStatement, expressionStatement.getExpression());
		return null;
	}

	@Override
	public Void visit(CnxLocalDeclaration localDeclaration) throws RuntimeException {
		Set<CnxResourceDeclaration> sources = new HashSet<>();
		List<CnxResourceDeclaration> reads = reads(localDeclaration, localDeclaration.getInitializer(), sources);
		shadowed.add(localDeclaration.getName());
		collector.addLocalSources(localDeclaration.getName(), sources);
		if (region == null) {
			checkRepeatedReads(localDeclaration, reads);
		}
		return null;
	}

	@Override
	public Void visit(CnxCriticalBlock criticalBlock) throws RuntimeException {
		visitBody(criticalBlock.getBody(), collector.openRegion(criticalBlock, region));
		return null;
	}

	@Override
	public Void visit(CnxBlock block) throws RuntimeException {
		visitBody(block.getBody(), region);
		return null;
	}

	@Override
	public Void visit(CnxIf cnxIf) throws RuntimeException {
		reads(cnxIf, cnxIf.getCondition());
		visitBody(cnxIf.getYes(), region);
		visitBody(cnxIf.getNo(), region);
		return null;
	}

	@Override
	public Void visit(CnxWhile cnxWhile) throws RuntimeException {
		reads(cnxWhile, cnxWhile.getCondition());
		visitBody(cnxWhile.getBody(), region);
		return null;
	}

	@Override
	public Void visit(CnxDoWhile doWhile) throws RuntimeException {
		visitBody(doWhile.getBody(), region);
		reads(doWhile, doWhile.getCondition());
		return null;
	}

	@Override
	public Void visit(CnxFor cnxFor) throws RuntimeException {
		CnxStatementAccessVisitor scope = nestedScope(region);
		if (cnxFor.getInit() != null) {
			cnxFor.getInit().accept(scope);
		}
		scope.reads(cnxFor, cnxFor.getCondition());
		if (cnxFor.getUpdate() != null) {
			cnxFor.getUpdate().accept(scope);
		}
		scope.visitBody(cnxFor.getBody(), region);
		return null;
	}

	@Override
	public Void visit(CnxReturn cnxReturn) throws RuntimeException {
		reads(cnxReturn, cnxReturn.getValue());
		return null;
	}

	@Override
	public Void visit(CnxBreak cnxBreak) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(CnxContinue cnxContinue) throws RuntimeException {
		return null;
	}
}
