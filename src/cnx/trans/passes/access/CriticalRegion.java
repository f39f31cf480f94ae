package cnx.trans.passes.access;

import cnx.model.context.ExecutionContext;
import cnx.model.program.CnxCriticalBlock;
import cnx.model.program.CnxResourceDeclaration;
import cnx.util.SourceLocation;

import java.util.*;

/**
 * A lexical critical block as seen by the analysis. Compile-time only: nothing of it exists at
 * run time except the enter and exit code emitted for it.
 */
public class CriticalRegion {
	private final String id;
	private final String owningFunction;
	private final CnxCriticalBlock block;
	private final SortedSet<ExecutionContext> contexts;
	private final CriticalRegion lexicalParent;
	private final SortedSet<CnxResourceDeclaration> directResources;
	private final SortedSet<CnxResourceDeclaration> calleeFootprint;
	private final Set<String> unanalyzableCallees;
	private final Set<String> resourceTouchingCallees;

	public CriticalRegion(String id, String owningFunction, CnxCriticalBlock block,
	                      SortedSet<ExecutionContext> contexts, CriticalRegion lexicalParent) {
		this.id = id;
		this.owningFunction = owningFunction;
		this.block = block;
		this.contexts = contexts;
		this.lexicalParent = lexicalParent;
		this.directResources = new TreeSet<>(CnxResourceDeclaration.BY_NAME);
		this.calleeFootprint = new TreeSet<>(CnxResourceDeclaration.BY_NAME);
		this.unanalyzableCallees = new LinkedHashSet<>();
		this.resourceTouchingCallees = new LinkedHashSet<>();
	}

	public String getId() {
		return id;
	}

	public String getOwningFunction() {
		return owningFunction;
	}

	public CnxCriticalBlock getBlock() {
		return block;
	}

	public SourceLocation getLocation() {
		return block.getLocation();
	}

	/**
	 * @return the contexts that can execute this region, i.e. those reaching its function
	 */
	public SortedSet<ExecutionContext> getContexts() {
		return contexts;
	}

	public Optional<CriticalRegion> getLexicalParent() {
		return Optional.ofNullable(lexicalParent);
	}

	/**
	 * @return resources referenced in the body itself, including nested blocks but not callees
	 */
	public SortedSet<CnxResourceDeclaration> getDirectResources() {
		return Collections.unmodifiableSortedSet(directResources);
	}

	/**
	 * @return resources touched by statically known callees whose whole call tree is visible
	 */
	public SortedSet<CnxResourceDeclaration> getCalleeFootprint() {
		return Collections.unmodifiableSortedSet(calleeFootprint);
	}

	/**
	 * @return external callees, and "(indirect)" for calls through pointers
	 */
	public Set<String> getUnanalyzableCallees() {
		return Collections.unmodifiableSet(unanalyzableCallees);
	}

	public Set<String> getResourceTouchingCallees() {
		return Collections.unmodifiableSet(resourceTouchingCallees);
	}

	/**
	 * @return true if the body calls any function not proven free of resource access
	 */
	public boolean containsOpaqueCall() {
		return !unanalyzableCallees.isEmpty() || !resourceTouchingCallees.isEmpty();
	}

	public Set<String> getOpaqueCallees() {
		Set<String> result = new LinkedHashSet<>(unanalyzableCallees);
		result.addAll(resourceTouchingCallees);
		return result;
	}

	void addDirectResource(CnxResourceDeclaration resource) {
		directResources.add(resource);
	}

	void addUnanalyzableCallee(String callee) {
		unanalyzableCallees.add(callee);
	}

	void addResourceTouchingCallee(String callee, Collection<CnxResourceDeclaration> footprint) {
		resourceTouchingCallees.add(callee);
		calleeFootprint.addAll(footprint);
	}

	@Override
	public String toString() {
		return "CriticalRegion(" + id + ")";
	}
}
