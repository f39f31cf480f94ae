package cnx.formatters;

import cnx.model.program.*;

import java.io.IOException;
import java.util.List;

public class CnxStatementFormattingVisitor extends CnxStatementVisitor<Void, IOException> {

	private final IndentingWriter out;

	public CnxStatementFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeBlock(List<CnxStatement> statements) throws IOException {
		out.write("{");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (CnxStatement statement : statements) {
				out.newLine();
				statement.accept(this);
			}
		}
		out.newLine();
		out.write("}");
	}

	@Override
	public Void visit(CnxAssignment assignment) throws IOException {
		out.write(assignment.getTarget());
		out.write(" ");
		out.write(assignment.getOperator().getSymbol());
		out.write(" ");
		assignment.getValue().accept(new CnxExpressionFormattingVisitor(out));
		out.write(";");
		return null;
	}

	@Override
	public Void visit(CnxExpressionStatement expressionStatement) throws IOException {
		expressionStatement.getExpression().accept(new CnxExpressionFormattingVisitor(out));
		out.write(";");
		return null;
	}

	@Override
	public Void visit(CnxLocalDeclaration localDeclaration) throws IOException {
		out.write(localDeclaration.getName());
		if (localDeclaration.getInitializer() != null) {
			out.write(" <- ");
			localDeclaration.getInitializer().accept(new CnxExpressionFormattingVisitor(out));
		}
		out.write(";");
		return null;
	}

	@Override
	public Void visit(CnxCriticalBlock criticalBlock) throws IOException {
		out.write("critical ");
		writeBlock(criticalBlock.getBody());
		return null;
	}

	@Override
	public Void visit(CnxBlock block) throws IOException {
		writeBlock(block.getBody());
		return null;
	}

	@Override
	public Void visit(CnxIf cnxIf) throws IOException {
		out.write("if (");
		cnxIf.getCondition().accept(new CnxExpressionFormattingVisitor(out));
		out.write(") ");
		writeBlock(cnxIf.getYes());
		if (!cnxIf.getNo().isEmpty()) {
			out.write(" else ");
			writeBlock(cnxIf.getNo());
		}
		return null;
	}

	@Override
	public Void visit(CnxWhile cnxWhile) throws IOException {
		out.write("while (");
		cnxWhile.getCondition().accept(new CnxExpressionFormattingVisitor(out));
		out.write(") ");
		writeBlock(cnxWhile.getBody());
		return null;
	}

	@Override
	public Void visit(CnxDoWhile doWhile) throws IOException {
		out.write("do ");
		writeBlock(doWhile.getBody());
		out.write(" while (");
		doWhile.getCondition().accept(new CnxExpressionFormattingVisitor(out));
		out.write(");");
		return null;
	}

	@Override
	public Void visit(CnxFor cnxFor) throws IOException {
		out.write("for (");
		if (cnxFor.getInit() != null) {
			cnxFor.getInit().accept(this);
		} else {
			out.write(";");
		}
		out.write(" ");
		if (cnxFor.getCondition() != null) {
			cnxFor.getCondition().accept(new CnxExpressionFormattingVisitor(out));
		}
		out.write(";");
		if (cnxFor.getUpdate() != null) {
			out.write(" ");
			cnxFor.getUpdate().accept(this);
		}
		out.write(") ");
		writeBlock(cnxFor.getBody());
		return null;
	}

	@Override
	public Void visit(CnxReturn cnxReturn) throws IOException {
		out.write("return");
		if (cnxReturn.getValue() != null) {
			out.write(" ");
			cnxReturn.getValue().accept(new CnxExpressionFormattingVisitor(out));
		}
		out.write(";");
		return null;
	}

	@Override
	public Void visit(CnxBreak cnxBreak) throws IOException {
		out.write("break;");
		return null;
	}

	@Override
	public Void visit(CnxContinue cnxContinue) throws IOException {
		out.write("continue;");
		return null;
	}
}
