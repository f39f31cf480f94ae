package cnx.formatters;

import cnx.model.context.ExecutionContext;
import cnx.trans.passes.access.AccessSite;
import cnx.trans.passes.ceiling.ResourceCeiling;
import cnx.trans.passes.codegen.AccessSiteEmission;
import cnx.trans.passes.codegen.EmissionPlan;
import cnx.trans.passes.codegen.RegionEmission;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * The emission plan as JSON, for the code emitter that splices fragments around statements.
 */
public class EmissionReportFormatter {
	private EmissionReportFormatter() {}

	public static JSONObject format(EmissionPlan plan) {
		JSONObject report = new JSONObject();
		report.put("target", plan.getCapabilities().getName());
		report.put("debug_guards", plan.hasDebugGuards());
		report.put("max_priority", plan.getMaxInterruptPriority());

		JSONArray resources = new JSONArray();
		for (ResourceCeiling ceiling : plan.getResources()) {
			JSONObject resource = new JSONObject();
			resource.put("name", ceiling.getResource().getName());
			resource.put("ceiling", ceiling.getCeiling());
			resource.put("lock_free", ceiling.isLockFree());
			JSONArray contexts = new JSONArray();
			for (ExecutionContext context : ceiling.getContexts()) {
				contexts.put(context.getName());
			}
			resource.put("contexts", contexts);
			resources.put(resource);
		}
		report.put("resources", resources);

		JSONArray regions = new JSONArray();
		for (RegionEmission emission : plan.getRegions()) {
			JSONObject region = new JSONObject();
			region.put("id", emission.getRegion().getId());
			region.put("function", emission.getRegion().getOwningFunction());
			region.put("line", emission.getRegion().getLocation().getLine());
			region.put("column", emission.getRegion().getLocation().getColumn());
			region.put("ceiling", emission.getCeiling());
			region.put("strategy", emission.getStrategy().getReportName());
			region.put("enter", emission.getEnter());
			region.put("exit", emission.getExit());
			region.put("nesting_parent", emission.getNestingParent()
					.<Object>map(p -> p.getId())
					.orElse(JSONObject.NULL));
			regions.put(region);
		}
		report.put("regions", regions);

		JSONArray sites = new JSONArray();
		for (AccessSiteEmission emission : plan.getSites()) {
			AccessSite site = emission.getSite();
			JSONObject entry = new JSONObject();
			entry.put("resource", site.getResource().getName());
			entry.put("function", site.getOwningFunction());
			entry.put("line", site.getLocation().getLine());
			entry.put("column", site.getLocation().getColumn());
			entry.put("operation", site.getOperation().name().toLowerCase());
			entry.put("strategy", emission.getStrategy().getReportName());
			entry.put("enter", emission.getEnter());
			entry.put("exit", emission.getExit());
			if (emission.getProtectingRegion().isPresent()) {
				entry.put("protected_by", emission.getProtectingRegion().get().getId());
			} else if (emission.isCoveredByCaller()) {
				entry.put("protected_by", "caller");
			}
			sites.put(entry);
		}
		report.put("access_sites", sites);
		return report;
	}
}
