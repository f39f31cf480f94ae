package cnx.trans.passes.reachability;

import cnx.model.program.*;

import java.util.function.Consumer;

public class CnxExpressionCallSiteVisitor extends CnxExpressionVisitor<Void, RuntimeException> {
	private final String caller;
	private final CnxCriticalBlock enclosingBlock;
	private final Consumer<CallSite> captureCallSite;

	public CnxExpressionCallSiteVisitor(String caller, CnxCriticalBlock enclosingBlock,
	                                    Consumer<CallSite> captureCallSite) {
		this.caller = caller;
		this.enclosingBlock = enclosingBlock;
		this.captureCallSite = captureCallSite;
	}

	@Override
	public Void visit(CnxVariableReference variableReference) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(CnxLiteral literal) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(CnxBinop binop) throws RuntimeException {
		binop.getLHS().accept(this);
		binop.getRHS().accept(this);
		return null;
	}

	@Override
	public Void visit(CnxUnop unop) throws RuntimeException {
		unop.getOperand().accept(this);
		return null;
	}

	@Override
	public Void visit(CnxCall call) throws RuntimeException {
		// arguments are evaluated before the call
		call.getArguments().forEach(a -> a.accept(this));
		captureCallSite.accept(new CallSite(caller, call.getCallee(), call, enclosingBlock));
		return null;
	}

	@Override
	public Void visit(CnxIndirectCall indirectCall) throws RuntimeException {
		indirectCall.getTarget().accept(this);
		indirectCall.getArguments().forEach(a -> a.accept(this));
		captureCallSite.accept(new CallSite(caller, null, indirectCall, enclosingBlock));
		return null;
	}
}
