package cnx.model.context;

import cnx.util.SourceLocation;

/**
 * A named path of execution with a fixed priority: the main line, or one interrupt handler.
 *
 * Contexts are ordered by registration so that every set of contexts iterates the same way
 * on every run.
 */
public final class ExecutionContext implements Comparable<ExecutionContext> {
	private final int index;
	private final String name;
	private final ContextKind kind;
	private final int priority;
	private final String entryFunction;
	private final SourceLocation location;

	ExecutionContext(int index, String name, ContextKind kind, int priority, String entryFunction,
	                 SourceLocation location) {
		this.index = index;
		this.name = name;
		this.kind = kind;
		this.priority = priority;
		this.entryFunction = entryFunction;
		this.location = location;
	}

	public String getName() {
		return name;
	}

	public ContextKind getKind() {
		return kind;
	}

	public int getPriority() {
		return priority;
	}

	public String getEntryFunction() {
		return entryFunction;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public boolean isInterrupt() {
		return kind == ContextKind.INTERRUPT;
	}

	@Override
	public int compareTo(ExecutionContext o) {
		return Integer.compare(index, o.index);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		ExecutionContext other = (ExecutionContext) obj;
		return index == other.index && name.equals(other.name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public String toString() {
		return name + ":" + priority;
	}
}
