package cnx.trans;

import cnx.CnxException;

/**
 * Exception raised when the concurrency analysis cannot hand a program over to code emission
 *
 */
public class CnxTransException extends CnxException {

	private static final long serialVersionUID = -3184470318810931740L;
	private static final String prefix = "Analysis Error";

	public CnxTransException(String msg) {
		super(prefix, msg);
	}

}
