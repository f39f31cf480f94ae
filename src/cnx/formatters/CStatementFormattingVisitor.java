package cnx.formatters;

import cnx.model.c.*;

import java.io.IOException;
import java.util.List;

public class CStatementFormattingVisitor extends CStatementVisitor<Void, IOException> {

	/**
	 * Written in place of a hole, so that the text around it can be split into enter and exit
	 * fragments.
	 */
	public static final String HOLE_MARKER = "/*@cnx-hole@*/";

	private final IndentingWriter out;

	public CStatementFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeBlock(List<CStatement> statements) throws IOException {
		out.write("{");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (CStatement statement : statements) {
				out.newLine();
				statement.accept(this);
			}
		}
		out.newLine();
		out.write("}");
	}

	@Override
	public Void visit(CVariableDeclaration variableDeclaration) throws IOException {
		out.write(variableDeclaration.getType());
		out.write(" ");
		out.write(variableDeclaration.getName());
		if (variableDeclaration.getInitializer() != null) {
			out.write(" = ");
			variableDeclaration.getInitializer().accept(new CExpressionFormattingVisitor(out));
		}
		out.write(";");
		return null;
	}

	@Override
	public Void visit(CExpressionStatement expressionStatement) throws IOException {
		expressionStatement.getExpression().accept(new CExpressionFormattingVisitor(out));
		out.write(";");
		return null;
	}

	@Override
	public Void visit(CIf cIf) throws IOException {
		out.write("if (");
		cIf.getCondition().accept(new CExpressionFormattingVisitor(out));
		out.write(") ");
		writeBlock(cIf.getThen());
		return null;
	}

	@Override
	public Void visit(CDoWhile doWhile) throws IOException {
		out.write("do ");
		writeBlock(doWhile.getBody());
		out.write(" while (");
		doWhile.getCondition().accept(new CExpressionFormattingVisitor(out));
		out.write(");");
		return null;
	}

	@Override
	public Void visit(CBreak cBreak) throws IOException {
		out.write("break;");
		return null;
	}

	@Override
	public Void visit(CStatementHole statementHole) throws IOException {
		out.write(HOLE_MARKER);
		return null;
	}
}
