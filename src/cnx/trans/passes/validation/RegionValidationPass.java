package cnx.trans.passes.validation;

import cnx.errors.IssueContext;
import cnx.model.context.ExecutionContext;
import cnx.model.program.CnxCriticalBlock;
import cnx.model.program.CnxFunction;
import cnx.model.program.CnxProgram;
import cnx.trans.passes.access.AccessCollection;
import cnx.trans.passes.access.CriticalRegion;
import cnx.trans.passes.access.WhileAnalyzingFunction;
import cnx.trans.passes.ceiling.CeilingTable;
import cnx.trans.passes.reachability.CallSite;
import cnx.trans.passes.reachability.Reachability;

import java.util.*;

public class RegionValidationPass {
	private RegionValidationPass() {}

	public static RegionNesting perform(IssueContext ctx, CnxProgram program, Reachability reachability,
	                                    AccessCollection collection, CeilingTable ceilings) {
		for (CnxFunction function : program.getFunctions()) {
			IssueContext fnCtx = ctx.withContext(new WhileAnalyzingFunction(function.getName()));
			CnxStatementEarlyExitVisitor visitor = new CnxStatementEarlyExitVisitor(collection, null, 0, fnCtx::error);
			function.getBody().forEach(s -> s.accept(visitor));
		}

		Map<String, CriticalRegion> parents = new HashMap<>();
		Map<String, List<CriticalRegion>> enclosing = new HashMap<>();
		for (CriticalRegion region : collection.getRegions()) {
			IssueContext fnCtx = ctx.withContext(new WhileAnalyzingFunction(region.getOwningFunction()));
			Optional<CriticalRegion> lexicalParent = region.getLexicalParent();
			if (lexicalParent.isPresent()) {
				parents.put(region.getId(), lexicalParent.get());
				enclosing.put(region.getId(), Collections.singletonList(lexicalParent.get()));
				fnCtx.warning(new NestedRegionWarning(region, lexicalParent.get(), false));
			} else if (reachability.isRegionCovered(region.getOwningFunction())) {
				List<CriticalRegion> callers = new ArrayList<>();
				findCallingRegions(reachability, collection, region.getOwningFunction(), new HashSet<>(), callers);
				enclosing.put(region.getId(), callers);
				for (CriticalRegion caller : callers) {
					if (sharesContext(region, caller)) {
						parents.put(region.getId(), caller);
						fnCtx.warning(new NestedRegionWarning(region, caller, true));
						break;
					}
				}
			}

			int ceiling = ceilings.getRegionCeiling(region);
			for (ExecutionContext context : region.getContexts()) {
				if (ceiling <= context.getPriority()) {
					fnCtx.warning(new RedundantRegionWarning(region, context, ceiling));
				}
			}
		}
		return new RegionNesting(parents, enclosing);
	}

	private static boolean sharesContext(CriticalRegion a, CriticalRegion b) {
		for (ExecutionContext context : a.getContexts()) {
			if (b.getContexts().contains(context)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Collects, in call-graph order, the innermost region around every call that leads into the
	 * region-covered function.
	 */
	private static void findCallingRegions(Reachability reachability, AccessCollection collection, String function,
	                                       Set<String> visited, List<CriticalRegion> result) {
		if (!visited.add(function)) {
			return;
		}
		for (CallSite site : reachability.getCallGraph().getCallSitesTo(function)) {
			Optional<CnxCriticalBlock> block = site.getEnclosingBlock();
			if (block.isPresent()) {
				collection.findRegion(block.get()).ifPresent(r -> {
					if (!result.contains(r)) {
						result.add(r);
					}
				});
			} else if (reachability.isRegionCovered(site.getCaller())) {
				findCallingRegions(reachability, collection, site.getCaller(), visited, result);
			}
		}
	}
}
