package cnx.model.program;

import cnx.util.SourceLocation;

import java.util.List;

public class CnxFunction {
	private final SourceLocation location;
	private final String name;
	private final List<String> locals;
	private final boolean addressTaken;
	private final List<CnxStatement> body;

	/**
	 * @param locals parameters and function-scope variables, which shadow resources of the same name
	 * @param addressTaken whether the program stores this function in a pointer or callback anywhere
	 */
	public CnxFunction(SourceLocation location, String name, List<String> locals, boolean addressTaken,
	                   List<CnxStatement> body) {
		this.location = location;
		this.name = name;
		this.locals = locals;
		this.addressTaken = addressTaken;
		this.body = body;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getName() {
		return name;
	}

	public List<String> getLocals() {
		return locals;
	}

	public boolean isAddressTaken() {
		return addressTaken;
	}

	public List<CnxStatement> getBody() {
		return body;
	}
}
