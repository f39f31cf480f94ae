package cnx.trans.passes.ceiling;

import cnx.errors.IssueContext;
import cnx.model.context.ContextRegistry;
import cnx.model.context.ExecutionContext;
import cnx.model.program.CnxResourceDeclaration;
import cnx.scope.UID;
import cnx.trans.passes.access.*;
import cnx.trans.passes.reachability.Reachability;

import java.util.*;

public class CeilingCalculationPass {
	private CeilingCalculationPass() {}

	public static CeilingTable perform(IssueContext ctx, ContextRegistry contexts, Reachability reachability,
	                                   AccessCollection collection, OpaqueCallPolicy policy) {
		Map<String, SortedSet<ExecutionContext>> accessors = new LinkedHashMap<>();
		Map<String, CnxResourceDeclaration> declarations = new LinkedHashMap<>();
		for (AccessSite site : collection.getSites()) {
			declarations.putIfAbsent(site.getResource().getName(), site.getResource());
			accessors.computeIfAbsent(site.getResource().getName(), k -> new TreeSet<>())
					.addAll(site.getContexts());
		}

		Map<String, ResourceCeiling> resourceCeilings = new LinkedHashMap<>();
		for (Map.Entry<String, CnxResourceDeclaration> entry : declarations.entrySet()) {
			SortedSet<ExecutionContext> accessing = accessors.get(entry.getKey());
			resourceCeilings.put(entry.getKey(), computeResourceCeiling(contexts, entry.getValue(), accessing));
		}

		int maxInterruptPriority = contexts.getMaxInterruptPriority();
		Map<String, Integer> regionCeilings = new LinkedHashMap<>();
		for (CriticalRegion region : collection.getRegions()) {
			int enclosing = 0;
			for (ExecutionContext context : region.getContexts()) {
				enclosing = Math.max(enclosing, contexts.getPriority(context));
			}

			Set<String> forcing = policy == OpaqueCallPolicy.FOOTPRINT
					? region.getUnanalyzableCallees()
					: region.getOpaqueCallees();
			int ceiling;
			if (!forcing.isEmpty()) {
				ceiling = Math.max(maxInterruptPriority, enclosing);
				ctx.warning(new OpaqueCallConservativeCeilingWarning(region, forcing, ceiling));
			} else {
				Set<CnxResourceDeclaration> resources = new LinkedHashSet<>(region.getDirectResources());
				if (policy == OpaqueCallPolicy.FOOTPRINT) {
					resources.addAll(region.getCalleeFootprint());
				}
				ceiling = enclosing;
				for (CnxResourceDeclaration resource : resources) {
					ResourceCeiling resourceCeiling = resourceCeilings.get(resource.getName());
					if (resourceCeiling != null) {
						ceiling = Math.max(ceiling, resourceCeiling.getCeiling());
					}
				}
			}
			regionCeilings.put(region.getId(), ceiling);
		}

		CeilingTable table = new CeilingTable(resourceCeilings, regionCeilings, maxInterruptPriority);
		checkMutations(ctx, reachability, collection, table);
		return table;
	}

	private static ResourceCeiling computeResourceCeiling(ContextRegistry contexts, CnxResourceDeclaration resource,
	                                                      SortedSet<ExecutionContext> accessing) {
		int ceiling = 0;
		Set<Integer> priorities = new HashSet<>();
		for (ExecutionContext context : accessing) {
			int priority = contexts.getPriority(context);
			priorities.add(priority);
			ceiling = Math.max(ceiling, priority);
		}
		return new ResourceCeiling(resource, ceiling, priorities.size() <= 1, accessing);
	}

	/**
	 * Every mutation of a resource that can be preempted must happen inside a critical block,
	 * in a function only ever called from one, or through an atomic form.
	 */
	private static void checkMutations(IssueContext ctx, Reachability reachability, AccessCollection collection,
	                                   CeilingTable table) {
		Set<UID> multiStepStatements = new HashSet<>();
		for (MultiStepCandidate candidate : collection.getMultiStepCandidates()) {
			if (table.isLockFree(candidate.getResource()) ||
					reachability.isRegionCovered(candidate.getOwningFunction())) {
				continue;
			}
			multiStepStatements.add(candidate.getStatement().getUID());
			ctx.withContext(new WhileAnalyzingFunction(candidate.getOwningFunction()))
					.error(new UnprotectedAtomicMultiStepIssue(candidate));
		}

		for (AccessSite site : collection.getSites()) {
			if (!site.getOperation().isMutation() ||
					site.getEnclosingRegion().isPresent() ||
					site.isAtomicForm() ||
					table.isLockFree(site.getResource()) ||
					reachability.isRegionCovered(site.getOwningFunction()) ||
					multiStepStatements.contains(site.getStatement().getUID())) {
				continue;
			}
			ctx.withContext(new WhileAnalyzingFunction(site.getOwningFunction()))
					.error(new UnprotectedResourceAccessIssue(site, table.getResourceCeiling(site.getResource())));
		}
	}
}
