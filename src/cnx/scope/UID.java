package cnx.scope;

import java.util.concurrent.atomic.AtomicLong;

/**
 * An identity for a program node. Two structurally equal statements in different places
 * of the program have different UIDs.
 */
public class UID {
	private static final AtomicLong counter = new AtomicLong();

	private final long id;

	public UID() {
		this.id = counter.getAndIncrement();
	}

	public long getId() {
		return id;
	}

	@Override
	public String toString() {
		return "UID(" + id + ")";
	}
}
