package cnx.trans.passes.debug;

import cnx.trans.passes.ceiling.CeilingTable;
import cnx.trans.passes.codegen.*;

import java.util.ArrayList;
import java.util.List;

public class DebugGuardInjectionPass {
	private DebugGuardInjectionPass() {}

	/**
	 * Builds a new plan in which every fragment that enters protection first checks that the
	 * running context is not above the ceiling the analysis computed for it. The given plan is
	 * left as it is.
	 */
	public static EmissionPlan perform(EmissionPlan plan, CeilingTable ceilings) {
		List<RegionEmission> regions = new ArrayList<>();
		for (RegionEmission region : plan.getRegions()) {
			if (region.getTemplate().isPresent()) {
				int ceiling = ceilings.getRegionCeiling(region.getRegion());
				regions.add(region.withTemplate(SynchronizationTemplates.debugGuard(
						region.getTemplate().get(), ceiling, region.getRegion().getId())));
			} else {
				regions.add(region);
			}
		}

		List<AccessSiteEmission> sites = new ArrayList<>();
		for (AccessSiteEmission site : plan.getSites()) {
			if (site.getTemplate().isPresent()) {
				int ceiling = ceilings.getResourceCeiling(site.getSite().getResource()).getCeiling();
				sites.add(site.withTemplate(SynchronizationTemplates.debugGuard(
						site.getTemplate().get(), ceiling, site.getId())));
			} else {
				sites.add(site);
			}
		}

		return new EmissionPlan(plan.getCapabilities(), plan.getMaxInterruptPriority(), plan.getResources(),
				regions, sites, true);
	}
}
