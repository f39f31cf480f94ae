package cnx.model.program;

import cnx.util.SourceLocation;

public class CnxVariableReference extends CnxExpression {
	private final String name;

	public CnxVariableReference(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(CnxExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		return name.equals(((CnxVariableReference) obj).name);
	}
}
