package cnx.trans.passes.access;

import cnx.model.program.CnxFunction;
import cnx.model.program.CnxProgram;
import cnx.model.program.CnxResourceDeclaration;
import cnx.trans.passes.reachability.CallGraph;
import cnx.trans.passes.reachability.CallSite;

import java.util.*;

/**
 * The resources a function touches, directly or through anything it calls.
 */
public class FunctionFootprint {
	private final String function;
	private final SortedSet<CnxResourceDeclaration> resources;
	private final boolean analyzable;

	private FunctionFootprint(String function, SortedSet<CnxResourceDeclaration> resources, boolean analyzable) {
		this.function = function;
		this.resources = Collections.unmodifiableSortedSet(resources);
		this.analyzable = analyzable;
	}

	public String getFunction() {
		return function;
	}

	public SortedSet<CnxResourceDeclaration> getResources() {
		return resources;
	}

	/**
	 * @return false if an indirect or external call is reachable from this function
	 */
	public boolean isAnalyzable() {
		return analyzable;
	}

	public boolean isResourceFree() {
		return analyzable && resources.isEmpty();
	}

	static Map<String, FunctionFootprint> computeAll(CnxProgram program, CallGraph callGraph,
	                                                 Map<String, Set<CnxResourceDeclaration>> directResources) {
		Map<String, SortedSet<CnxResourceDeclaration>> footprints = new LinkedHashMap<>();
		Map<String, Boolean> analyzable = new HashMap<>();
		for (CnxFunction function : program.getFunctions()) {
			SortedSet<CnxResourceDeclaration> set = new TreeSet<>(CnxResourceDeclaration.BY_NAME);
			set.addAll(directResources.getOrDefault(function.getName(), Collections.emptySet()));
			footprints.put(function.getName(), set);
			boolean ok = true;
			for (CallSite site : callGraph.getCallSitesIn(function.getName())) {
				if (site.isIndirect() || !program.findFunction(site.getCallee().get()).isPresent()) {
					ok = false;
					break;
				}
			}
			analyzable.put(function.getName(), ok);
		}

		boolean changed = true;
		while (changed) {
			changed = false;
			for (CnxFunction function : program.getFunctions()) {
				String name = function.getName();
				for (String callee : callGraph.getCallees(name)) {
					if (!footprints.containsKey(callee)) {
						continue;
					}
					if (footprints.get(name).addAll(footprints.get(callee))) {
						changed = true;
					}
					if (analyzable.get(name) && !analyzable.get(callee)) {
						analyzable.put(name, false);
						changed = true;
					}
				}
			}
		}

		Map<String, FunctionFootprint> result = new LinkedHashMap<>();
		footprints.forEach((name, resources) ->
				result.put(name, new FunctionFootprint(name, resources, analyzable.get(name))));
		return result;
	}
}
