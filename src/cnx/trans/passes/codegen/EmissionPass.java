package cnx.trans.passes.codegen;

import cnx.model.context.ExecutionContext;
import cnx.model.program.CnxAssignment;
import cnx.model.program.CnxResourceDeclaration;
import cnx.trans.passes.access.AccessCollection;
import cnx.trans.passes.access.AccessOperation;
import cnx.trans.passes.access.AccessSite;
import cnx.trans.passes.access.CriticalRegion;
import cnx.trans.passes.ceiling.CeilingTable;
import cnx.trans.passes.ceiling.ResourceCeiling;
import cnx.trans.passes.reachability.Reachability;
import cnx.trans.passes.validation.RegionNesting;

import java.util.*;

public class EmissionPass {
	private EmissionPass() {}

	/**
	 * Chooses a strategy and code for every region and access. Only ceilings, nesting and target
	 * capabilities decide, and everything is visited in program order, so the same input always
	 * gives the same plan.
	 */
	public static EmissionPlan perform(Reachability reachability, AccessCollection collection, CeilingTable ceilings,
	                                   RegionNesting nesting, TargetCapabilities capabilities) {
		int counter = 0;

		Map<String, RegionEmission> regionEmissions = new LinkedHashMap<>();
		for (CriticalRegion region : collection.getRegions()) {
			int ceiling = ceilings.getRegionCeiling(region);
			CriticalRegion parent = nesting.getNestingParent(region).orElse(null);
			if (addsNoProtection(region, ceiling)) {
				regionEmissions.put(region.getId(),
						new RegionEmission(region, ceiling, SynchronizationStrategy.NONE, null, parent));
				continue;
			}
			counter += 1;
			if (capabilities.supportsSelectiveMasking()) {
				boolean raise = ceiling > activeThreshold(nesting.getEnclosingRegions(region), ceilings);
				regionEmissions.put(region.getId(), new RegionEmission(region, ceiling,
						SynchronizationStrategy.SELECTIVE_MASK,
						SynchronizationTemplates.selectiveMask(counter, ceiling, raise), parent));
			} else {
				regionEmissions.put(region.getId(), new RegionEmission(region, ceiling,
						SynchronizationStrategy.GLOBAL_DISABLE, SynchronizationTemplates.globalDisable(counter), parent));
			}
		}

		List<AccessSiteEmission> siteEmissions = new ArrayList<>();
		for (AccessSite site : collection.getSites()) {
			CnxResourceDeclaration resource = site.getResource();
			ResourceCeiling resourceCeiling = ceilings.getResourceCeiling(resource);
			int ceiling = resourceCeiling.getCeiling();

			Optional<CriticalRegion> region = site.getEnclosingRegion();
			if (region.isPresent()) {
				RegionEmission regionEmission = regionEmissions.get(region.get().getId());
				siteEmissions.add(new AccessSiteEmission(site, regionEmission.getCeiling(),
						regionEmission.getStrategy(), null, region.get(), false));
				continue;
			}
			if (resourceCeiling.isLockFree() || addsNoProtection(site.getContexts(), ceiling)) {
				siteEmissions.add(new AccessSiteEmission(site, ceiling, SynchronizationStrategy.NONE, null, null, false));
				continue;
			}
			if (reachability.isRegionCovered(site.getOwningFunction())) {
				siteEmissions.add(new AccessSiteEmission(site, ceiling, SynchronizationStrategy.NONE, null, null, true));
				continue;
			}
			if (resource.isAtomic() && site.getOperation() != AccessOperation.READ_MODIFY_WRITE &&
					capabilities.isSingleAccess(resource.getType())) {
				siteEmissions.add(new AccessSiteEmission(site, ceiling, SynchronizationStrategy.NONE, null, null, false));
				continue;
			}

			counter += 1;
			if (resource.isAtomic() && site.getOperation() == AccessOperation.READ_MODIFY_WRITE &&
					capabilities.supportsLockFreeRetry(resource.getType()) && isPureUpdate(site)) {
				siteEmissions.add(new AccessSiteEmission(site, ceiling, SynchronizationStrategy.LOCK_FREE_RETRY,
						SynchronizationTemplates.lockFreeRetry(counter, resource, site.getAssignmentOperator().get()),
						null, false));
			} else if (capabilities.supportsSelectiveMasking()) {
				siteEmissions.add(new AccessSiteEmission(site, ceiling, SynchronizationStrategy.SELECTIVE_MASK,
						SynchronizationTemplates.selectiveMask(counter, ceiling, true), null, false));
			} else {
				siteEmissions.add(new AccessSiteEmission(site, ceiling, SynchronizationStrategy.GLOBAL_DISABLE,
						SynchronizationTemplates.globalDisable(counter), null, false));
			}
		}

		return new EmissionPlan(capabilities, ceilings.getMaxInterruptPriority(),
				new ArrayList<>(ceilings.getResourceCeilings().values()),
				new ArrayList<>(regionEmissions.values()), siteEmissions, false);
	}

	// the operand is evaluated inside the retry loop, so it must be free of calls
	private static boolean isPureUpdate(AccessSite site) {
		if (!(site.getStatement() instanceof CnxAssignment)) {
			return false;
		}
		return !((CnxAssignment) site.getStatement()).getValue().accept(new CnxExpressionContainsCallVisitor());
	}

	private static boolean addsNoProtection(CriticalRegion region, int ceiling) {
		return addsNoProtection(region.getContexts(), ceiling);
	}

	// no context executing the code can be preempted by anything the ceiling would mask
	private static boolean addsNoProtection(Collection<ExecutionContext> contexts, int ceiling) {
		for (ExecutionContext context : contexts) {
			if (ceiling > context.getPriority()) {
				return false;
			}
		}
		return true;
	}

	/**
	 * The lowest ceiling among the regions that may be active on entry, or -1 when the code can
	 * be entered with none active.
	 */
	private static int activeThreshold(List<CriticalRegion> enclosing, CeilingTable ceilings) {
		if (enclosing.isEmpty()) {
			return -1;
		}
		int threshold = Integer.MAX_VALUE;
		for (CriticalRegion region : enclosing) {
			threshold = Math.min(threshold, ceilings.getRegionCeiling(region));
		}
		return threshold;
	}
}
