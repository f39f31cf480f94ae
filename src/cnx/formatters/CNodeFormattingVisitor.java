package cnx.formatters;

import cnx.model.c.CExpression;
import cnx.model.c.CNodeVisitor;
import cnx.model.c.CStatement;

import java.io.IOException;

public class CNodeFormattingVisitor extends CNodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public CNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(CStatement statement) throws IOException {
		statement.accept(new CStatementFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(CExpression expression) throws IOException {
		expression.accept(new CExpressionFormattingVisitor(out));
		return null;
	}
}
