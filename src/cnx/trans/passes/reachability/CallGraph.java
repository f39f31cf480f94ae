package cnx.trans.passes.reachability;

import cnx.model.program.CnxFunction;
import cnx.model.program.CnxProgram;
import cnx.model.program.CnxStatement;

import java.util.*;

/**
 * Caller to callee edges of a program, derived from the function bodies. Indirect calls are
 * kept as call sites without a callee.
 */
public class CallGraph {
	private final List<CallSite> callSites;
	private final Map<String, List<CallSite>> sitesByCaller;
	private final Map<String, List<CallSite>> sitesByCallee;

	private CallGraph(List<CallSite> callSites) {
		this.callSites = Collections.unmodifiableList(callSites);
		this.sitesByCaller = new HashMap<>();
		this.sitesByCallee = new HashMap<>();
		for (CallSite site : callSites) {
			sitesByCaller.computeIfAbsent(site.getCaller(), k -> new ArrayList<>()).add(site);
			site.getCallee().ifPresent(callee ->
					sitesByCallee.computeIfAbsent(callee, k -> new ArrayList<>()).add(site));
		}
	}

	public static CallGraph build(CnxProgram program) {
		List<CallSite> sites = new ArrayList<>();
		for (CnxFunction function : program.getFunctions()) {
			CnxStatementCallSiteVisitor visitor = new CnxStatementCallSiteVisitor(function.getName(), null, sites::add);
			for (CnxStatement statement : function.getBody()) {
				statement.accept(visitor);
			}
		}
		return new CallGraph(sites);
	}

	public List<CallSite> getCallSites() {
		return callSites;
	}

	public List<CallSite> getCallSitesIn(String caller) {
		return sitesByCaller.getOrDefault(caller, Collections.emptyList());
	}

	public List<CallSite> getCallSitesTo(String callee) {
		return sitesByCallee.getOrDefault(callee, Collections.emptyList());
	}

	/**
	 * @return statically known callees of the function, in call order, without repeats
	 */
	public Set<String> getCallees(String caller) {
		Set<String> callees = new LinkedHashSet<>();
		for (CallSite site : getCallSitesIn(caller)) {
			site.getCallee().ifPresent(callees::add);
		}
		return callees;
	}

	public List<CallSite> getIndirectCallSites() {
		List<CallSite> result = new ArrayList<>();
		for (CallSite site : callSites) {
			if (site.isIndirect()) {
				result.add(site);
			}
		}
		return result;
	}
}
