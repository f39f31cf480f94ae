package cnx.model.program;

import java.util.*;

/**
 * Everything the front-end hands over for concurrency analysis: declared contexts, shared
 * resources, function bodies and the names of functions defined outside the program.
 */
public class CnxProgram {
	private final List<CnxContextDeclaration> contexts;
	private final List<CnxResourceDeclaration> resources;
	private final List<CnxFunction> functions;
	private final Set<String> externalFunctions;
	private final Map<String, CnxFunction> functionsByName;
	private final Map<String, CnxResourceDeclaration> resourcesByName;

	public CnxProgram(List<CnxContextDeclaration> contexts, List<CnxResourceDeclaration> resources,
	                  List<CnxFunction> functions, Set<String> externalFunctions) {
		this.contexts = Collections.unmodifiableList(contexts);
		this.resources = Collections.unmodifiableList(resources);
		this.functions = Collections.unmodifiableList(functions);
		this.externalFunctions = Collections.unmodifiableSet(externalFunctions);
		this.functionsByName = new LinkedHashMap<>();
		for (CnxFunction function : functions) {
			functionsByName.putIfAbsent(function.getName(), function);
		}
		this.resourcesByName = new LinkedHashMap<>();
		for (CnxResourceDeclaration resource : resources) {
			resourcesByName.putIfAbsent(resource.getName(), resource);
		}
	}

	public List<CnxContextDeclaration> getContexts() {
		return contexts;
	}

	public List<CnxResourceDeclaration> getResources() {
		return resources;
	}

	public List<CnxFunction> getFunctions() {
		return functions;
	}

	public Set<String> getExternalFunctions() {
		return externalFunctions;
	}

	public Optional<CnxFunction> findFunction(String name) {
		return Optional.ofNullable(functionsByName.get(name));
	}

	public Optional<CnxResourceDeclaration> findResource(String name) {
		return Optional.ofNullable(resourcesByName.get(name));
	}
}
