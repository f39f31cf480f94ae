package cnx.model.program;

import cnx.util.SourceLocation;

/**
 * Any literal the front-end has already lowered to its C spelling.
 */
public class CnxLiteral extends CnxExpression {
	private final String value;

	public CnxLiteral(SourceLocation location, String value) {
		super(location);
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(CnxExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return value.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		return value.equals(((CnxLiteral) obj).value);
	}
}
