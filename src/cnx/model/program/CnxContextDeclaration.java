package cnx.model.program;

import cnx.model.context.ContextKind;
import cnx.util.SourceLocation;

/**
 * An execution context as declared in the program: the main line or an interrupt handler.
 */
public class CnxContextDeclaration {
	private final SourceLocation location;
	private final String name;
	private final ContextKind kind;
	private final Integer priority;
	private final String entryFunction;

	/**
	 * @param priority null when the declaration leaves it out
	 */
	public CnxContextDeclaration(SourceLocation location, String name, ContextKind kind, Integer priority,
	                             String entryFunction) {
		this.location = location;
		this.name = name;
		this.kind = kind;
		this.priority = priority;
		this.entryFunction = entryFunction;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getName() {
		return name;
	}

	public ContextKind getKind() {
		return kind;
	}

	public Integer getPriority() {
		return priority;
	}

	public String getEntryFunction() {
		return entryFunction;
	}
}
