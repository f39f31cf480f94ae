package cnx.formatters;

import cnx.model.program.*;

import java.io.IOException;

public class CnxExpressionFormattingVisitor extends CnxExpressionVisitor<Void, IOException> {

	private final IndentingWriter out;

	public CnxExpressionFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(CnxVariableReference variableReference) throws IOException {
		out.write(variableReference.getName());
		return null;
	}

	@Override
	public Void visit(CnxLiteral literal) throws IOException {
		out.write(literal.getValue());
		return null;
	}

	@Override
	public Void visit(CnxBinop binop) throws IOException {
		out.write("(");
		binop.getLHS().accept(this);
		out.write(" ");
		out.write(binop.getOperation());
		out.write(" ");
		binop.getRHS().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(CnxUnop unop) throws IOException {
		out.write(unop.getOperation());
		unop.getOperand().accept(this);
		return null;
	}

	@Override
	public Void visit(CnxCall call) throws IOException {
		out.write(call.getCallee());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, call.getArguments(), a -> a.accept(this));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(CnxIndirectCall indirectCall) throws IOException {
		indirectCall.getTarget().accept(this);
		out.write("(");
		FormattingTools.writeCommaSeparated(out, indirectCall.getArguments(), a -> a.accept(this));
		out.write(")");
		return null;
	}
}
