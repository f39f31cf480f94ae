package cnx.model.c;

public abstract class CStatement extends CNode {

	public abstract <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(CNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
