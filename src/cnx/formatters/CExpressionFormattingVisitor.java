package cnx.formatters;

import cnx.model.c.*;

import java.io.IOException;

public class CExpressionFormattingVisitor extends CExpressionVisitor<Void, IOException> {

	private final IndentingWriter out;

	public CExpressionFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(CVariable variable) throws IOException {
		out.write(variable.getName());
		return null;
	}

	@Override
	public Void visit(CIntLiteral intLiteral) throws IOException {
		out.write(Long.toString(intLiteral.getValue()));
		return null;
	}

	@Override
	public Void visit(CStringLiteral stringLiteral) throws IOException {
		out.write("\"");
		for (char c : stringLiteral.getValue().toCharArray()) {
			if (c == '"' || c == '\\') {
				out.write('\\');
			}
			out.write(c);
		}
		out.write("\"");
		return null;
	}

	@Override
	public Void visit(CCall call) throws IOException {
		out.write(call.getFunction());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, call.getArguments(), a -> a.accept(this));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(CBinop binop) throws IOException {
		binop.getLhs().accept(this);
		out.write(" ");
		out.write(binop.getOperation());
		out.write(" ");
		binop.getRhs().accept(this);
		return null;
	}

	@Override
	public Void visit(CAddressOf addressOf) throws IOException {
		out.write("&");
		addressOf.getOperand().accept(this);
		return null;
	}

	@Override
	public Void visit(CParenthesized parenthesized) throws IOException {
		out.write("(");
		parenthesized.getInner().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(CExpressionHole expressionHole) throws IOException {
		out.write(CStatementFormattingVisitor.HOLE_MARKER);
		return null;
	}
}
