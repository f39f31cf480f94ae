package cnx.model.program;

import cnx.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A call through a function pointer or callback field. Its target cannot be resolved statically.
 */
public class CnxIndirectCall extends CnxExpression {
	private final CnxExpression target;
	private final List<CnxExpression> arguments;

	public CnxIndirectCall(SourceLocation location, CnxExpression target, List<CnxExpression> arguments) {
		super(location);
		this.target = target;
		this.arguments = arguments;
	}

	public CnxExpression getTarget() {
		return target;
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
		return Objects.hash(target, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		CnxIndirectCall other = (CnxIndirectCall) obj;
		return target.equals(other.target) && arguments.equals(other.arguments);
	}
}
