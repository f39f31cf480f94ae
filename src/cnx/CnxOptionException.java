package cnx;

public class CnxOptionException extends Exception {
	private static final long serialVersionUID = 4411285739028415632L;

	public CnxOptionException(String message) {
		super(message);
	}
}
