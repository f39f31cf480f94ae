package cnx.trans.passes.codegen;

import cnx.trans.passes.access.CriticalRegion;

import java.util.Optional;

public class RegionEmission {
	private final CriticalRegion region;
	private final int ceiling;
	private final SynchronizationStrategy strategy;
	private final SynchronizationTemplate template;
	private final CriticalRegion nestingParent;

	public RegionEmission(CriticalRegion region, int ceiling, SynchronizationStrategy strategy,
	                      SynchronizationTemplate template, CriticalRegion nestingParent) {
		this.region = region;
		this.ceiling = ceiling;
		this.strategy = strategy;
		this.template = template;
		this.nestingParent = nestingParent;
	}

	public CriticalRegion getRegion() {
		return region;
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

	public Optional<CriticalRegion> getNestingParent() {
		return Optional.ofNullable(nestingParent);
	}

	public String getEnter() {
		return template == null ? "" : template.getEnter();
	}

	public String getExit() {
		return template == null ? "" : template.getExit();
	}

	public RegionEmission withTemplate(SynchronizationTemplate newTemplate) {
		return new RegionEmission(region, ceiling, strategy, newTemplate, nestingParent);
	}
}
