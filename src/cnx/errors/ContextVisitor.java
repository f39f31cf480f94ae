package cnx.errors;

import cnx.trans.passes.access.WhileAnalyzingFunction;
import cnx.trans.passes.parse.WhileLoadingProgram;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileLoadingProgram whileLoadingProgram) throws E;
	public abstract T visit(WhileAnalyzingFunction whileAnalyzingFunction) throws E;

}
