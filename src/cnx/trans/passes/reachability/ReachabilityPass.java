package cnx.trans.passes.reachability;

import cnx.errors.IssueContext;
import cnx.model.context.ContextRegistry;
import cnx.model.context.ExecutionContext;
import cnx.model.program.CnxFunction;
import cnx.model.program.CnxProgram;
import cnx.trans.passes.access.WhileAnalyzingFunction;

import java.util.*;

public class ReachabilityPass {
	private ReachabilityPass() {}

	/**
	 * Seeds every context's entry function with that context and propagates along call edges
	 * until nothing changes. Context sets only grow, so this terminates on recursive call graphs;
	 * a worklist is used instead of recursion so deep call chains cannot exhaust the stack.
	 */
	public static Reachability perform(IssueContext ctx, CnxProgram program, ContextRegistry contexts,
	                                   UnresolvedCallPolicy policy) {
		CallGraph callGraph = CallGraph.build(program);

		Map<String, SortedSet<ExecutionContext>> reach = new LinkedHashMap<>();
		for (CnxFunction function : program.getFunctions()) {
			reach.put(function.getName(), new TreeSet<>());
		}

		Deque<String> worklist = new ArrayDeque<>();
		for (ExecutionContext context : contexts.getContexts()) {
			String entry = context.getEntryFunction();
			if (!reach.containsKey(entry)) {
				ctx.error(new MissingEntryFunctionIssue(context));
				continue;
			}
			reach.get(entry).add(context);
			worklist.add(entry);
		}

		switch (policy) {
			case REJECT:
				for (CallSite site : callGraph.getIndirectCallSites()) {
					ctx.withContext(new WhileAnalyzingFunction(site.getCaller()))
							.error(new UnresolvableCallIssue(site));
				}
				break;
			case ASSUME_ALL_CONTEXTS:
				for (CnxFunction function : program.getFunctions()) {
					if (function.isAddressTaken()) {
						reach.get(function.getName()).addAll(contexts.getContexts());
						worklist.add(function.getName());
					}
				}
				break;
		}

		while (!worklist.isEmpty()) {
			String function = worklist.poll();
			SortedSet<ExecutionContext> callerContexts = reach.get(function);
			for (String callee : callGraph.getCallees(function)) {
				SortedSet<ExecutionContext> calleeContexts = reach.get(callee);
				if (calleeContexts == null) {
					// external function, nothing to propagate into
					continue;
				}
				if (calleeContexts.addAll(callerContexts)) {
					worklist.add(callee);
				}
			}
		}

		Set<String> regionCovered = computeRegionCovered(program, contexts, callGraph, reach, policy);
		return new Reachability(reach, regionCovered, callGraph);
	}

	private static Set<String> computeRegionCovered(CnxProgram program, ContextRegistry contexts, CallGraph callGraph,
	                                                Map<String, SortedSet<ExecutionContext>> reach,
	                                                UnresolvedCallPolicy policy) {
		// start from every candidate and remove functions until the set is stable
		Set<String> covered = new LinkedHashSet<>();
		for (CnxFunction function : program.getFunctions()) {
			String name = function.getName();
			if (contexts.isEntryFunction(name) || reach.get(name).isEmpty()) {
				continue;
			}
			if (function.isAddressTaken() && policy == UnresolvedCallPolicy.ASSUME_ALL_CONTEXTS) {
				continue;
			}
			covered.add(name);
		}
		boolean changed = true;
		while (changed) {
			changed = false;
			Iterator<String> it = covered.iterator();
			while (it.hasNext()) {
				String function = it.next();
				for (CallSite site : callGraph.getCallSitesTo(function)) {
					boolean callerReachable = !reach.getOrDefault(site.getCaller(), Collections.emptySortedSet()).isEmpty();
					if (callerReachable && !site.isInsideCriticalBlock() && !covered.contains(site.getCaller())) {
						it.remove();
						changed = true;
						break;
					}
				}
			}
		}
		return covered;
	}
}
