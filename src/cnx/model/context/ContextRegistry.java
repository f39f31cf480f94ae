package cnx.model.context;

import cnx.util.SourceLocation;

import java.util.*;

/**
 * The execution contexts of a program and their priorities. Built once before any analysis
 * runs and never modified afterwards.
 */
public final class ContextRegistry {
	public static final String MAIN_CONTEXT_NAME = "main";

	private final List<ExecutionContext> contexts;
	private final Map<String, ExecutionContext> byName;

	private ContextRegistry(List<ExecutionContext> contexts) {
		this.contexts = Collections.unmodifiableList(new ArrayList<>(contexts));
		Map<String, ExecutionContext> byName = new HashMap<>();
		for (ExecutionContext context : contexts) {
			byName.put(context.getName(), context);
		}
		this.byName = Collections.unmodifiableMap(byName);
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<ExecutionContext> getContexts() {
		return contexts;
	}

	public Optional<ExecutionContext> findByName(String name) {
		return Optional.ofNullable(byName.get(name));
	}

	public int getPriority(ExecutionContext context) {
		return context.getPriority();
	}

	public int getPriority(String name) {
		ExecutionContext context = byName.get(name);
		if (context == null) {
			throw new NoSuchElementException("no execution context named " + name);
		}
		return context.getPriority();
	}

	public List<ExecutionContext> findByEntryFunction(String functionName) {
		List<ExecutionContext> result = new ArrayList<>();
		for (ExecutionContext context : contexts) {
			if (context.getEntryFunction().equals(functionName)) {
				result.add(context);
			}
		}
		return result;
	}

	public boolean isEntryFunction(String functionName) {
		return !findByEntryFunction(functionName).isEmpty();
	}

	/**
	 * @return the highest priority of any interrupt context, or 0 if the program has none
	 */
	public int getMaxInterruptPriority() {
		int max = 0;
		for (ExecutionContext context : contexts) {
			if (context.isInterrupt()) {
				max = Math.max(max, context.getPriority());
			}
		}
		return max;
	}

	public static final class Builder {
		private final List<ExecutionContext> contexts = new ArrayList<>();
		private final Map<String, ExecutionContext> byName = new HashMap<>();
		private ExecutionContext main;

		private Builder() {}

		public ExecutionContext register(String name, ContextKind kind, String entryFunction) {
			return register(SourceLocation.unknown(), name, kind, null, entryFunction);
		}

		/**
		 * @param priority null defaults to 0
		 * @throws DuplicateContextIssue if the name is already taken, or if this is a second main context
		 */
		public ExecutionContext register(SourceLocation location, String name, ContextKind kind, Integer priority,
		                                 String entryFunction) {
			if (byName.containsKey(name)) {
				throw new DuplicateContextIssue(name, location, byName.get(name).getLocation());
			}
			if (kind == ContextKind.MAIN && main != null) {
				throw new DuplicateContextIssue(name, location, main.getLocation());
			}
			int effectivePriority = priority == null ? 0 : priority;
			if (effectivePriority < 0) {
				throw new IllegalArgumentException("context " + name + " has negative priority " + priority);
			}
			ExecutionContext context = new ExecutionContext(
					contexts.size(), name, kind, effectivePriority, entryFunction, location);
			contexts.add(context);
			byName.put(name, context);
			if (kind == ContextKind.MAIN) {
				main = context;
			}
			return context;
		}

		public boolean hasMain() {
			return main != null;
		}

		public ContextRegistry build() {
			return new ContextRegistry(contexts);
		}
	}
}
