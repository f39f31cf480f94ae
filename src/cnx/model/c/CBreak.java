package cnx.model.c;

public class CBreak extends CStatement {
	@Override
	public <T, E extends Throwable> T accept(CStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return o != null && getClass() == o.getClass();
	}

	@Override
	public int hashCode() {
		return CBreak.class.hashCode();
	}
}
