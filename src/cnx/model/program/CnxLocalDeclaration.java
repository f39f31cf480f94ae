package cnx.model.program;

import cnx.util.SourceLocation;

import java.util.Objects;

public class CnxLocalDeclaration extends CnxStatement {
	private final String name;
	private final CnxExpression initializer;

	/**
	 * @param initializer may be null
	 */
	public CnxLocalDeclaration(SourceLocation location, String name, CnxExpression initializer) {
		super(location);
		this.name = name;
		this.initializer = initializer;
	}

	public String getName() {
		return name;
	}

	public CnxExpression getInitializer() {
		return initializer;
	}

	@Override
	public <T, E extends Throwable> T accept(CnxStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, initializer);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		CnxLocalDeclaration other = (CnxLocalDeclaration) obj;
		return name.equals(other.name) && Objects.equals(initializer, other.initializer);
	}
}
