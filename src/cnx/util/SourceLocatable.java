package cnx.util;

/**
 *
 * A common abstract base, typically meant for program nodes, that should be
 * implemented by anything that needs to be traced back to its
 * location in the front-end export.
 *
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}
