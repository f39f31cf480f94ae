package cnx.model.c;

import java.util.List;
import java.util.Objects;

public class CCall extends CExpression {
	private final String function;
	private final List<CExpression> arguments;

	public CCall(String function, List<CExpression> arguments) {
		this.function = function;
		this.arguments = arguments;
	}

	public String getFunction() {
		return function;
	}

	public List<CExpression> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CCall call = (CCall) o;
		return Objects.equals(function, call.function) &&
				Objects.equals(arguments, call.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(function, arguments);
	}
}
