package cnx.model.program;

import cnx.util.SourceLocation;

public abstract class CnxExpression extends CnxNode {
	public CnxExpression(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(CnxNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(CnxExpressionVisitor<T, E> v) throws E;
}
