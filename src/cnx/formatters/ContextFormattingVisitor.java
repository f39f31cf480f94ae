package cnx.formatters;

import cnx.errors.ContextVisitor;
import cnx.trans.passes.access.WhileAnalyzingFunction;
import cnx.trans.passes.parse.WhileLoadingProgram;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileLoadingProgram whileLoadingProgram) throws IOException {
		out.write("while loading program export ");
		out.write(whileLoadingProgram.getExportPath().toString());
		return null;
	}

	@Override
	public Void visit(WhileAnalyzingFunction whileAnalyzingFunction) throws IOException {
		out.write("while analyzing function ");
		out.write(whileAnalyzingFunction.getFunctionName());
		return null;
	}

}
