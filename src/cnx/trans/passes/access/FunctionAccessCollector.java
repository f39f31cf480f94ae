package cnx.trans.passes.access;

import cnx.model.context.ExecutionContext;
import cnx.model.program.*;

import java.util.*;

/**
 * Per-function state while walking one function body.
 */
class FunctionAccessCollector {
	private final CnxProgram program;
	private final String function;
	private final SortedSet<ExecutionContext> contexts;
	private final List<AccessSite> sites = new ArrayList<>();
	private final List<CriticalRegion> regions = new ArrayList<>();
	private final List<MultiStepCandidate> multiStepCandidates = new ArrayList<>();
	private final Set<CnxResourceDeclaration> directResources = new LinkedHashSet<>();
	// local name -> resources its current value may have been computed from
	private final Map<String, Set<CnxResourceDeclaration>> localSources = new HashMap<>();
	private int regionCounter = 0;

	FunctionAccessCollector(CnxProgram program, String function, SortedSet<ExecutionContext> contexts) {
		this.program = program;
		this.function = function;
		this.contexts = contexts;
	}

	CnxProgram getProgram() {
		return program;
	}

	Optional<CnxResourceDeclaration> resolve(String name, Set<String> shadowed) {
		if (shadowed.contains(name)) {
			return Optional.empty();
		}
		return program.findResource(name);
	}

	CriticalRegion openRegion(CnxCriticalBlock block, CriticalRegion lexicalParent) {
		regionCounter += 1;
		CriticalRegion region = new CriticalRegion(
				function + "#" + regionCounter, function, block, contexts, lexicalParent);
		regions.add(region);
		return region;
	}

	void addSite(CnxResourceDeclaration resource, AccessOperation operation, CriticalRegion region,
	             CnxStatement statement, CnxNode node, AssignmentOperator assignmentOperator) {
		sites.add(new AccessSite(resource, function, operation, region, contexts, statement,
				node.getLocation(), assignmentOperator));
		directResources.add(resource);
		for (CriticalRegion r = region; r != null; r = r.getLexicalParent().orElse(null)) {
			r.addDirectResource(resource);
		}
	}

	void addMultiStepCandidate(CnxResourceDeclaration resource, CnxStatement statement, String suggestedRewrite) {
		multiStepCandidates.add(new MultiStepCandidate(resource, function, statement, contexts, suggestedRewrite));
	}

	/**
	 * Records that the local may now hold a value computed from the given resources. Sources
	 * only accumulate, so a later store cannot hide an earlier read on another path.
	 */
	void addLocalSources(String local, Collection<CnxResourceDeclaration> sources) {
		if (!sources.isEmpty()) {
			localSources.computeIfAbsent(local, k -> new HashSet<>()).addAll(sources);
		}
	}

	Set<CnxResourceDeclaration> getLocalSources(String local) {
		return localSources.getOrDefault(local, Collections.emptySet());
	}

	List<AccessSite> getSites() {
		return sites;
	}

	List<CriticalRegion> getRegions() {
		return regions;
	}

	List<MultiStepCandidate> getMultiStepCandidates() {
		return multiStepCandidates;
	}

	Set<CnxResourceDeclaration> getDirectResources() {
		return directResources;
	}
}
