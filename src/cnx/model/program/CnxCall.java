package cnx.model.program;

import cnx.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A call whose target is statically known by name.
 */
public class CnxCall extends CnxExpression {
	private final String callee;
	private final List<CnxExpression> arguments;

	public CnxCall(SourceLocation location, String callee, List<CnxExpression> arguments) {
		super(location);
		this.callee = callee;
		this.arguments = arguments;
	}

	public String getCallee() {
		return callee;
	}

	public List<CnxExpression> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(CnxExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(callee, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		CnxCall other = (CnxCall) obj;
		return callee.equals(other.callee) && arguments.equals(other.arguments);
	}
}
