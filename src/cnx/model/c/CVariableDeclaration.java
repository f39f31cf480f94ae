package cnx.model.c;

import java.util.Objects;

public class CVariableDeclaration extends CStatement {
	private final String type;
	private final String name;
	private final CExpression initializer;

	public CVariableDeclaration(String type, String name, CExpression initializer) {
		this.type = type;
		this.name = name;
		this.initializer = initializer;
	}

	public String getType() {
		return type;
	}

	public String getName() {
		return name;
	}

	public CExpression getInitializer() {
		return initializer;
	}

	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CVariableDeclaration variableDeclaration = (CVariableDeclaration) o;
		return Objects.equals(type, variableDeclaration.type) &&
				Objects.equals(name, variableDeclaration.name) &&
				Objects.equals(initializer, variableDeclaration.initializer);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, name, initializer);
	}
}
