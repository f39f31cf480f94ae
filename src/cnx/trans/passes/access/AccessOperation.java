package cnx.trans.passes.access;

public enum AccessOperation {
	READ,
	WRITE,
	READ_MODIFY_WRITE;

	public boolean isMutation() {
		return this != READ;
	}
}
