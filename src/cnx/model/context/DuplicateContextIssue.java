package cnx.model.context;

import cnx.errors.Issue;
import cnx.errors.IssueVisitor;
import cnx.util.SourceLocation;

public class DuplicateContextIssue extends Issue {
	private final String name;
	private final SourceLocation location;
	private final SourceLocation previousLocation;

	public DuplicateContextIssue(String name, SourceLocation location, SourceLocation previousLocation) {
		this.name = name;
		this.location = location;
		this.previousLocation = previousLocation;
	}

	public String getName() {
		return name;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public SourceLocation getPreviousLocation() {
		return previousLocation;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
