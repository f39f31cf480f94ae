package cnx.model.c;

import java.util.Objects;

public class CVariable extends CExpression {
	private final String name;

	public CVariable(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(CExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CVariable variable = (CVariable) o;
		return Objects.equals(name, variable.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name);
	}
}
