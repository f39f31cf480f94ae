package cnx.trans.passes.parse;

import cnx.errors.Issue;
import cnx.errors.IssueVisitor;
import cnx.model.program.CnxResourceDeclaration;

public class DuplicateResourceIssue extends Issue {
	private final CnxResourceDeclaration declaration;
	private final CnxResourceDeclaration previous;

	public DuplicateResourceIssue(CnxResourceDeclaration declaration, CnxResourceDeclaration previous) {
		this.declaration = declaration;
		this.previous = previous;
	}

	public CnxResourceDeclaration getDeclaration() {
		return declaration;
	}

	public CnxResourceDeclaration getPrevious() {
		return previous;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
