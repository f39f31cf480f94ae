package cnx.model.program;

import cnx.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class CnxFor extends CnxStatement {
	private final CnxStatement init;
	private final CnxExpression condition;
	private final CnxStatement update;
	private final List<CnxStatement> body;

	/**
	 * init, condition and update may each be null
	 */
	public CnxFor(SourceLocation location, CnxStatement init, CnxExpression condition, CnxStatement update,
	              List<CnxStatement> body) {
		super(location);
		this.init = init;
		this.condition = condition;
		this.update = update;
		this.body = body;
	}

	public CnxStatement getInit() {
		return init;
	}

	public CnxExpression getCondition() {
		return condition;
	}

	public CnxStatement getUpdate() {
		return update;
	}

	public List<CnxStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(CnxStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(init, condition, update, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		CnxFor other = (CnxFor) obj;
		return Objects.equals(init, other.init) && Objects.equals(condition, other.condition) &&
				Objects.equals(update, other.update) && body.equals(other.body);
	}
}
