package cnx.trans.passes.ceiling;

import cnx.InternalCompilerError;
import cnx.model.program.CnxResourceDeclaration;
import cnx.trans.passes.access.CriticalRegion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ceilings of every resource and region, fixed before any code is emitted.
 */
public final class CeilingTable {
	private final Map<String, ResourceCeiling> resourceCeilings;
	private final Map<String, Integer> regionCeilings;
	private final int maxInterruptPriority;

	CeilingTable(Map<String, ResourceCeiling> resourceCeilings, Map<String, Integer> regionCeilings,
	             int maxInterruptPriority) {
		this.resourceCeilings = Collections.unmodifiableMap(new LinkedHashMap<>(resourceCeilings));
		this.regionCeilings = Collections.unmodifiableMap(new LinkedHashMap<>(regionCeilings));
		this.maxInterruptPriority = maxInterruptPriority;
	}

	public ResourceCeiling getResourceCeiling(CnxResourceDeclaration resource) {
		ResourceCeiling ceiling = resourceCeilings.get(resource.getName());
		if (ceiling == null) {
			throw new InternalCompilerError("no ceiling computed for resource " + resource.getName());
		}
		return ceiling;
	}

	public boolean isLockFree(CnxResourceDeclaration resource) {
		return getResourceCeiling(resource).isLockFree();
	}

	public int getRegionCeiling(CriticalRegion region) {
		Integer ceiling = regionCeilings.get(region.getId());
		if (ceiling == null) {
			throw new InternalCompilerError("no ceiling computed for region " + region.getId());
		}
		return ceiling;
	}

	public Map<String, ResourceCeiling> getResourceCeilings() {
		return resourceCeilings;
	}

	public Map<String, Integer> getRegionCeilings() {
		return regionCeilings;
	}

	public int getMaxInterruptPriority() {
		return maxInterruptPriority;
	}
}
