package cnx.trans.passes.access;

import cnx.model.program.CnxFunction;
import cnx.model.program.CnxProgram;
import cnx.model.program.CnxResourceDeclaration;
import cnx.trans.passes.reachability.CallGraph;
import cnx.trans.passes.reachability.CallSite;
import cnx.trans.passes.reachability.Reachability;

import java.util.*;

public class AccessCollectionPass {
	private AccessCollectionPass() {}

	public static final String INDIRECT_CALLEE = "(indirect call)";

	/**
	 * Collects every resource access and every critical block of the program. Each site and
	 * region is attributed to all contexts reaching its function.
	 */
	public static AccessCollection perform(CnxProgram program, Reachability reachability) {
		List<AccessSite> sites = new ArrayList<>();
		List<CriticalRegion> regions = new ArrayList<>();
		List<MultiStepCandidate> candidates = new ArrayList<>();
		Map<String, Set<CnxResourceDeclaration>> directResources = new HashMap<>();

		for (CnxFunction function : program.getFunctions()) {
			FunctionAccessCollector collector = new FunctionAccessCollector(
					program, function.getName(), reachability.getContexts(function.getName()));
			CnxStatementAccessVisitor visitor = new CnxStatementAccessVisitor(
					collector, null, new HashSet<>(function.getLocals()));
			function.getBody().forEach(s -> s.accept(visitor));
			sites.addAll(collector.getSites());
			regions.addAll(collector.getRegions());
			candidates.addAll(collector.getMultiStepCandidates());
			directResources.put(function.getName(), collector.getDirectResources());
		}

		CallGraph callGraph = reachability.getCallGraph();
		Map<String, FunctionFootprint> footprints = FunctionFootprint.computeAll(program, callGraph, directResources);
		AccessCollection collection = new AccessCollection(sites, regions, candidates, footprints);

		for (CallSite site : callGraph.getCallSites()) {
			if (!site.getEnclosingBlock().isPresent()) {
				continue;
			}
			CriticalRegion region = collection.findRegion(site.getEnclosingBlock().get()).orElse(null);
			for (CriticalRegion r = region; r != null; r = r.getLexicalParent().orElse(null)) {
				recordCallee(r, site, footprints);
			}
		}
		return collection;
	}

	private static void recordCallee(CriticalRegion region, CallSite site, Map<String, FunctionFootprint> footprints) {
		if (site.isIndirect()) {
			region.addUnanalyzableCallee(INDIRECT_CALLEE);
			return;
		}
		String callee = site.getCallee().get();
		FunctionFootprint footprint = footprints.get(callee);
		if (footprint == null || !footprint.isAnalyzable()) {
			region.addUnanalyzableCallee(callee);
		} else if (!footprint.getResources().isEmpty()) {
			region.addResourceTouchingCallee(callee, footprint.getResources());
		}
	}
}
