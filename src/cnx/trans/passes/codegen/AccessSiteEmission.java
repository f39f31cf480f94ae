package cnx.trans.passes.codegen;

import cnx.trans.passes.access.AccessSite;
import cnx.trans.passes.access.CriticalRegion;

import java.util.Optional;

/**
 * How one access is protected. An access inside a critical block takes the block's strategy and
 * needs no code of its own; an access in a function only ever called from inside critical blocks
 * is protected by its callers.
 */
public class AccessSiteEmission {
	private final AccessSite site;
	private final int ceiling;
	private final SynchronizationStrategy strategy;
	private final SynchronizationTemplate template;
	private final CriticalRegion protectingRegion;
	private final boolean coveredByCaller;

	public AccessSiteEmission(AccessSite site, int ceiling, SynchronizationStrategy strategy,
	                          SynchronizationTemplate template, CriticalRegion protectingRegion,
	                          boolean coveredByCaller) {
		this.site = site;
		this.ceiling = ceiling;
		this.strategy = strategy;
		this.template = template;
		this.protectingRegion = protectingRegion;
		this.coveredByCaller = coveredByCaller;
	}

	public AccessSite getSite() {
		return site;
	}

	public String getId() {
		return site.getResource().getName() + "@" + site.getOwningFunction() + ":" +
				site.getLocation().getLine() + ":" + site.getLocation().getColumn();
	}

	public int getCeiling() {
		return ceiling;
	}

	public SynchronizationStrategy getStrategy() {
		return strategy;
	}

	public Optional<SynchronizationTemplate> getTemplate() {
		return Optional.ofNullable(template);
	}

	public Optional<CriticalRegion> getProtectingRegion() {
		return Optional.ofNullable(protectingRegion);
	}

	public boolean isCoveredByCaller() {
		return coveredByCaller;
	}

	public String getEnter() {
		return template == null ? "" : template.getEnter();
	}

	public String getExit() {
		return template == null ? "" : template.getExit();
	}

	public AccessSiteEmission withTemplate(SynchronizationTemplate newTemplate) {
		return new AccessSiteEmission(site, ceiling, strategy, newTemplate, protectingRegion, coveredByCaller);
	}
}
