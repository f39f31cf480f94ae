package cnx.trans.passes.reachability;

import cnx.model.context.ExecutionContext;

import java.util.*;

/**
 * For every function, the execution contexts that can statically reach it.
 */
public final class Reachability {
	private final Map<String, SortedSet<ExecutionContext>> contextsByFunction;
	private final Set<String> regionCovered;
	private final CallGraph callGraph;

	Reachability(Map<String, SortedSet<ExecutionContext>> contextsByFunction, Set<String> regionCovered,
	             CallGraph callGraph) {
		Map<String, SortedSet<ExecutionContext>> copy = new LinkedHashMap<>();
		contextsByFunction.forEach((function, contexts) ->
				copy.put(function, Collections.unmodifiableSortedSet(new TreeSet<>(contexts))));
		this.contextsByFunction = Collections.unmodifiableMap(copy);
		this.regionCovered = Collections.unmodifiableSet(new LinkedHashSet<>(regionCovered));
		this.callGraph = callGraph;
	}

	public Map<String, SortedSet<ExecutionContext>> asMap() {
		return contextsByFunction;
	}

	/**
	 * @return the contexts reaching the function; empty for unknown or unreachable functions
	 */
	public SortedSet<ExecutionContext> getContexts(String function) {
		SortedSet<ExecutionContext> contexts = contextsByFunction.get(function);
		return contexts == null ? Collections.emptySortedSet() : contexts;
	}

	public boolean isReachable(String function) {
		return !getContexts(function).isEmpty();
	}

	/**
	 * A function is region-covered when every call to it, along every path from an entry point,
	 * happens inside a critical block. Its accesses are then protected by that block even
	 * though they are not lexically inside it.
	 */
	public boolean isRegionCovered(String function) {
		return regionCovered.contains(function);
	}

	public Set<String> getRegionCovered() {
		return regionCovered;
	}

	public CallGraph getCallGraph() {
		return callGraph;
	}
}
