package cnx.model.c;

import java.util.Objects;

public class CStringLiteral extends CExpression {
	private final String value;

	public CStringLiteral(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CStringLiteral stringLiteral = (CStringLiteral) o;
		return Objects.equals(value, stringLiteral.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
