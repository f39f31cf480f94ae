package cnx.model.c;

import java.util.Objects;

public class CIntLiteral extends CExpression {
	private final long value;

	public CIntLiteral(long value) {
		this.value = value;
	}

	public long getValue() {
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
		CIntLiteral intLiteral = (CIntLiteral) o;
		return value == intLiteral.value;
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
