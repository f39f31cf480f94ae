package cnx.model.context;

public enum ContextKind {
	MAIN,
	INTERRUPT,
}
