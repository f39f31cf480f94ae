package cnx.trans.passes.ceiling;

import cnx.model.context.ExecutionContext;
import cnx.model.program.CnxResourceDeclaration;

import java.util.Collections;
import java.util.SortedSet;

public class ResourceCeiling {
	private final CnxResourceDeclaration resource;
	private final int ceiling;
	private final boolean lockFree;
	private final SortedSet<ExecutionContext> contexts;

	public ResourceCeiling(CnxResourceDeclaration resource, int ceiling, boolean lockFree,
	                       SortedSet<ExecutionContext> contexts) {
		this.resource = resource;
		this.ceiling = ceiling;
		this.lockFree = lockFree;
		this.contexts = Collections.unmodifiableSortedSet(contexts);
	}

	public CnxResourceDeclaration getResource() {
		return resource;
	}

	/**
	 * @return the highest priority of any context accessing the resource
	 */
	public int getCeiling() {
		return ceiling;
	}

	/**
	 * @return true when every accessing context has the same priority, so none can preempt another
	 */
	public boolean isLockFree() {
		return lockFree;
	}

	public SortedSet<ExecutionContext> getContexts() {
		return contexts;
	}

	@Override
	public String toString() {
		return resource.getName() + "@" + ceiling + (lockFree ? " (lock-free)" : "");
	}
}
