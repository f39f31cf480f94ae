package cnx.trans.passes.parse;

import cnx.util.SourceLocation;

/**
 * A node of the program export that does not have the expected shape.
 */
class ProgramFormatException extends Exception {
	private static final long serialVersionUID = -6312018233454096447L;

	private final SourceLocation location;

	ProgramFormatException(SourceLocation location, String message) {
		super(message);
		this.location = location;
	}

	SourceLocation getLocation() {
		return location;
	}
}
