package cnx.trans.passes.access;

import cnx.errors.Context;
import cnx.errors.ContextVisitor;

public class WhileAnalyzingFunction extends Context {

	private final String functionName;

	public WhileAnalyzingFunction(String functionName) {
		this.functionName = functionName;
	}

	public String getFunctionName() {
		return functionName;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
