package cnx.trans.passes.codegen;

import cnx.trans.passes.ceiling.ResourceCeiling;

import java.util.*;

public final class EmissionPlan {
	private final TargetCapabilities capabilities;
	private final int maxInterruptPriority;
	private final List<ResourceCeiling> resources;
	private final List<RegionEmission> regions;
	private final List<AccessSiteEmission> sites;
	private final boolean debugGuards;

	public EmissionPlan(TargetCapabilities capabilities, int maxInterruptPriority, List<ResourceCeiling> resources,
	                    List<RegionEmission> regions, List<AccessSiteEmission> sites, boolean debugGuards) {
		this.capabilities = capabilities;
		this.maxInterruptPriority = maxInterruptPriority;
		this.resources = Collections.unmodifiableList(new ArrayList<>(resources));
		this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
		this.sites = Collections.unmodifiableList(new ArrayList<>(sites));
		this.debugGuards = debugGuards;
	}

	public TargetCapabilities getCapabilities() {
		return capabilities;
	}

	public int getMaxInterruptPriority() {
		return maxInterruptPriority;
	}

	public List<ResourceCeiling> getResources() {
		return resources;
	}

	public List<RegionEmission> getRegions() {
		return regions;
	}

	public Optional<RegionEmission> findRegion(String id) {
		for (RegionEmission emission : regions) {
			if (emission.getRegion().getId().equals(id)) {
				return Optional.of(emission);
			}
		}
		return Optional.empty();
	}

	public List<AccessSiteEmission> getSites() {
		return sites;
	}

	/**
	 * @return sites that need code of their own, i.e. those outside any critical block with a
	 * strategy other than NONE
	 */
	public List<AccessSiteEmission> getProtectedSites() {
		List<AccessSiteEmission> result = new ArrayList<>();
		for (AccessSiteEmission site : sites) {
			if (site.getTemplate().isPresent()) {
				result.add(site);
			}
		}
		return result;
	}

	public boolean hasDebugGuards() {
		return debugGuards;
	}

	/**
	 * @return every runtime helper some fragment of this plan calls, in prelude order
	 */
	public Set<RuntimeHelper> getHelpers() {
		EnumSet<RuntimeHelper> helpers = EnumSet.noneOf(RuntimeHelper.class);
		for (RegionEmission region : regions) {
			region.getTemplate().ifPresent(t -> helpers.addAll(t.getHelpers()));
		}
		for (AccessSiteEmission site : sites) {
			site.getTemplate().ifPresent(t -> helpers.addAll(t.getHelpers()));
		}
		return helpers;
	}

	public boolean emitsCode() {
		for (RegionEmission region : regions) {
			if (region.getTemplate().isPresent()) {
				return true;
			}
		}
		return !getProtectedSites().isEmpty();
	}
}
