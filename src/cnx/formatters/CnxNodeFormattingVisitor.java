package cnx.formatters;

import cnx.model.program.CnxExpression;
import cnx.model.program.CnxNodeVisitor;
import cnx.model.program.CnxStatement;

import java.io.IOException;

public class CnxNodeFormattingVisitor extends CnxNodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public CnxNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(CnxStatement statement) throws IOException {
		statement.accept(new CnxStatementFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(CnxExpression expression) throws IOException {
		expression.accept(new CnxExpressionFormattingVisitor(out));
		return null;
	}
}
