package cnx.trans.passes.access;

import cnx.model.context.ExecutionContext;
import cnx.model.program.AssignmentOperator;
import cnx.model.program.CnxResourceDeclaration;
import cnx.model.program.CnxStatement;
import cnx.util.SourceLocation;

import java.util.Optional;
import java.util.SortedSet;

/**
 * One reference to a shared resource. It is attributed to every context that can reach the
 * function it appears in, since any of them may perform it at run time.
 */
public class AccessSite {
	private final CnxResourceDeclaration resource;
	private final String owningFunction;
	private final AccessOperation operation;
	private final CriticalRegion enclosingRegion;
	private final SortedSet<ExecutionContext> contexts;
	private final CnxStatement statement;
	private final SourceLocation location;
	private final AssignmentOperator assignmentOperator;

	/**
	 * @param enclosingRegion innermost region, or null outside any region
	 * @param assignmentOperator the operator when this site is the target of an assignment, otherwise null
	 */
	public AccessSite(CnxResourceDeclaration resource, String owningFunction, AccessOperation operation,
	                  CriticalRegion enclosingRegion, SortedSet<ExecutionContext> contexts, CnxStatement statement,
	                  SourceLocation location, AssignmentOperator assignmentOperator) {
		this.resource = resource;
		this.owningFunction = owningFunction;
		this.operation = operation;
		this.enclosingRegion = enclosingRegion;
		this.contexts = contexts;
		this.statement = statement;
		this.location = location;
		this.assignmentOperator = assignmentOperator;
	}

	public CnxResourceDeclaration getResource() {
		return resource;
	}

	public String getOwningFunction() {
		return owningFunction;
	}

	public AccessOperation getOperation() {
		return operation;
	}

	public Optional<CriticalRegion> getEnclosingRegion() {
		return Optional.ofNullable(enclosingRegion);
	}

	public SortedSet<ExecutionContext> getContexts() {
		return contexts;
	}

	public CnxStatement getStatement() {
		return statement;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public Optional<AssignmentOperator> getAssignmentOperator() {
		return Optional.ofNullable(assignmentOperator);
	}

	/**
	 * Loads, stores and compound assignments of an atomic resource are single-variable atomic
	 * operations.
	 */
	public boolean isAtomicForm() {
		return resource.isAtomic();
	}

	@Override
	public String toString() {
		return operation + " " + resource.getName() + " in " + owningFunction +
				(enclosingRegion == null ? "" : " [" + enclosingRegion.getId() + "]");
	}
}
