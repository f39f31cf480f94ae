package cnx.trans.passes.reachability;

import cnx.model.program.CnxCriticalBlock;
import cnx.model.program.CnxExpression;
import cnx.util.SourceLocation;

import java.util.Optional;

/**
 * One call expression in a function body, with the innermost critical block it sits in.
 */
public class CallSite {
	private final String caller;
	private final String callee;
	private final CnxExpression expression;
	private final CnxCriticalBlock enclosingBlock;

	/**
	 * @param callee null when the call is indirect
	 * @param enclosingBlock null when the call is outside any critical block of the caller
	 */
	public CallSite(String caller, String callee, CnxExpression expression, CnxCriticalBlock enclosingBlock) {
		this.caller = caller;
		this.callee = callee;
		this.expression = expression;
		this.enclosingBlock = enclosingBlock;
	}

	public String getCaller() {
		return caller;
	}

	public Optional<String> getCallee() {
		return Optional.ofNullable(callee);
	}

	public boolean isIndirect() {
		return callee == null;
	}

	public CnxExpression getExpression() {
		return expression;
	}

	public SourceLocation getLocation() {
		return expression.getLocation();
	}

	public Optional<CnxCriticalBlock> getEnclosingBlock() {
		return Optional.ofNullable(enclosingBlock);
	}

	public boolean isInsideCriticalBlock() {
		return enclosingBlock != null;
	}
}
