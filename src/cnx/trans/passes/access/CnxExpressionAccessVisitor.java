package cnx.trans.passes.access;

import cnx.model.program.*;

import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Finds every read of a resource in an expression. Names in the shadowed set are locals, and
 * reads of those go to the optional local callback.
 */
public class CnxExpressionAccessVisitor extends CnxExpressionVisitor<Void, RuntimeException> {
	private final CnxProgram program;
	private final Set<String> shadowed;
	private final BiConsumer<CnxResourceDeclaration, CnxVariableReference> captureRead;
	private final Consumer<String> captureLocal;

	public CnxExpressionAccessVisitor(CnxProgram program, Set<String> shadowed,
	                                  BiConsumer<CnxResourceDeclaration, CnxVariableReference> captureRead) {
		this(program, shadowed, captureRead, local -> {});
	}

	public CnxExpressionAccessVisitor(CnxProgram program, Set<String> shadowed,
	                                  BiConsumer<CnxResourceDeclaration, CnxVariableReference> captureRead,
	                                  Consumer<String> captureLocal) {
		this.program = program;
		this.shadowed = shadowed;
		this.captureRead = captureRead;
		this.captureLocal = captureLocal;
	}

	@Override
	public Void visit(CnxVariableReference variableReference) throws RuntimeException {
		if (shadowed.contains(variableReference.getName())) {
			captureLocal.accept(variableReference.getName());
		} else {
			program.findResource(variableReference.getName())
					.ifPresent(resource -> captureRead.accept(resource, variableReference));
		}
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
		call.getArguments().forEach(a -> a.accept(this));
		return null;
	}

	@Override
	public Void visit(CnxIndirectCall indirectCall) throws RuntimeException {
		indirectCall.getTarget().accept(this);
		indirectCall.getArguments().forEach(a -> a.accept(this));
		return null;
	}
}
