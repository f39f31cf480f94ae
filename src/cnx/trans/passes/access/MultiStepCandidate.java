package cnx.trans.passes.access;

import cnx.model.context.ExecutionContext;
import cnx.model.program.CnxResourceDeclaration;
import cnx.model.program.CnxStatement;

import java.util.Optional;
import java.util.SortedSet;

/**
 * A statement outside any critical block that performs several dependent operations on one
 * resource, either by itself or together with an earlier statement whose result it uses. Whether it is an error depends on the resource's ceiling.
 */
public class MultiStepCandidate {
	private final CnxResourceDeclaration resource;
	private final String owningFunction;
	private final CnxStatement statement;
	private final SortedSet<ExecutionContext> contexts;
	private final String suggestedRewrite;

	public MultiStepCandidate(CnxResourceDeclaration resource, String owningFunction, CnxStatement statement,
	                          SortedSet<ExecutionContext> contexts, String suggestedRewrite) {
		this.resource = resource;
		this.owningFunction = owningFunction;
		this.statement = statement;
		this.contexts = contexts;
		this.suggestedRewrite = suggestedRewrite;
	}

	public CnxResourceDeclaration getResource() {
		return resource;
	}

	public String getOwningFunction() {
		return owningFunction;
	}

	public CnxStatement getStatement() {
		return statement;
	}

	public SortedSet<ExecutionContext> getContexts() {
		return contexts;
	}

	/**
	 * @return an equivalent statement in atomic form, when one exists
	 */
	public Optional<String> getSuggestedRewrite() {
		return Optional.ofNullable(suggestedRewrite);
	}
}
