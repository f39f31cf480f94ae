package cnx.trans.passes.codegen;

import cnx.model.program.*;

/**
 * True if evaluating the expression calls a function. Such a value cannot be recomputed on
 * every retry of an exclusive store.
 */
public class CnxExpressionContainsCallVisitor extends CnxExpressionVisitor<Boolean, RuntimeException> {
	@Override
	public Boolean visit(CnxVariableReference variableReference) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(CnxLiteral literal) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(CnxBinop binop) throws RuntimeException {
		return binop.getLHS().accept(this) || binop.getRHS().accept(this);
	}

	@Override
	public Boolean visit(CnxUnop unop) throws RuntimeException {
		return unop.getOperand().accept(this);
	}

	@Override
	public Boolean visit(CnxCall call) throws RuntimeException {
		return true;
	}

	@Override
	public Boolean visit(CnxIndirectCall indirectCall) throws RuntimeException {
		return true;
	}
}
