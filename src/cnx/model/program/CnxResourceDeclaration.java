package cnx.model.program;

import cnx.util.SourceLocation;

import java.util.Comparator;

public class CnxResourceDeclaration {
	public static final Comparator<CnxResourceDeclaration> BY_NAME =
			Comparator.comparing(CnxResourceDeclaration::getName);

	private final SourceLocation location;
	private final String name;
	private final ResourceKind kind;
	private final CnxType type;

	public CnxResourceDeclaration(SourceLocation location, String name, ResourceKind kind, CnxType type) {
		this.location = location;
		this.name = name;
		this.kind = kind;
		this.type = type;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getName() {
		return name;
	}

	public ResourceKind getKind() {
		return kind;
	}

	public CnxType getType() {
		return type;
	}

	public boolean isAtomic() {
		return kind == ResourceKind.ATOMIC;
	}

	@Override
	public String toString() {
		return (isAtomic() ? "atomic " : "") + type.getName() + " " + name;
	}
}
