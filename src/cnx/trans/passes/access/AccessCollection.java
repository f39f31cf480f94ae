package cnx.trans.passes.access;

import cnx.model.program.CnxCriticalBlock;
import cnx.model.program.CnxResourceDeclaration;
import cnx.scope.UID;

import java.util.*;

public class AccessCollection {
	private final List<AccessSite> sites;
	private final List<CriticalRegion> regions;
	private final List<MultiStepCandidate> multiStepCandidates;
	private final Map<String, FunctionFootprint> footprints;
	private final Map<UID, CriticalRegion> regionsByBlock;

	AccessCollection(List<AccessSite> sites, List<CriticalRegion> regions,
	                 List<MultiStepCandidate> multiStepCandidates, Map<String, FunctionFootprint> footprints) {
		this.sites = Collections.unmodifiableList(sites);
		this.regions = Collections.unmodifiableList(regions);
		this.multiStepCandidates = Collections.unmodifiableList(multiStepCandidates);
		this.footprints = Collections.unmodifiableMap(footprints);
		this.regionsByBlock = new HashMap<>();
		for (CriticalRegion region : regions) {
			regionsByBlock.put(region.getBlock().getUID(), region);
		}
	}

	public List<AccessSite> getSites() {
		return sites;
	}

	public List<AccessSite> getSitesOn(CnxResourceDeclaration resource) {
		List<AccessSite> result = new ArrayList<>();
		for (AccessSite site : sites) {
			if (site.getResource() == resource) {
				result.add(site);
			}
		}
		return result;
	}

	/**
	 * @return regions in function order, and in lexical pre-order within a function
	 */
	public List<CriticalRegion> getRegions() {
		return regions;
	}

	public Optional<CriticalRegion> findRegion(CnxCriticalBlock block) {
		return Optional.ofNullable(regionsByBlock.get(block.getUID()));
	}

	public Optional<CriticalRegion> findRegion(String id) {
		for (CriticalRegion region : regions) {
			if (region.getId().equals(id)) {
				return Optional.of(region);
			}
		}
		return Optional.empty();
	}

	public List<CriticalRegion> getRegionsIn(String function) {
		List<CriticalRegion> result = new ArrayList<>();
		for (CriticalRegion region : regions) {
			if (region.getOwningFunction().equals(function)) {
				result.add(region);
			}
		}
		return result;
	}

	public List<MultiStepCandidate> getMultiStepCandidates() {
		return multiStepCandidates;
	}

	public Optional<FunctionFootprint> getFootprint(String function) {
		return Optional.ofNullable(footprints.get(function));
	}
}
