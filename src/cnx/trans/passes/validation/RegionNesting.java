package cnx.trans.passes.validation;

import cnx.trans.passes.access.CriticalRegion;

import java.util.*;

/**
 * Nesting between regions. Besides the reported parent, tracks every region that can be
 * active when a region is entered, since a helper may be called from more than one place.
 */
public final class RegionNesting {
	private final Map<String, CriticalRegion> parents;
	private final Map<String, List<CriticalRegion>> enclosingRegions;

	RegionNesting(Map<String, CriticalRegion> parents, Map<String, List<CriticalRegion>> enclosingRegions) {
		this.parents = Collections.unmodifiableMap(new HashMap<>(parents));
		Map<String, List<CriticalRegion>> copy = new HashMap<>();
		enclosingRegions.forEach((id, regions) -> copy.put(id, Collections.unmodifiableList(new ArrayList<>(regions))));
		this.enclosingRegions = Collections.unmodifiableMap(copy);
	}

	public Optional<CriticalRegion> getNestingParent(CriticalRegion region) {
		return Optional.ofNullable(parents.get(region.getId()));
	}

	/**
	 * @return the innermost region active around each way this region can be entered; empty
	 * if it can be entered with no region active
	 */
	public List<CriticalRegion> getEnclosingRegions(CriticalRegion region) {
		return enclosingRegions.getOrDefault(region.getId(), Collections.emptyList());
	}
}
