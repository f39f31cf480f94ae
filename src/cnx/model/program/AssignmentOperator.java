package cnx.model.program;

import java.util.Optional;

/**
 * C-Next assignment operators. Compound forms on an atomic resource are the language's
 * single-variable read-modify-write operation.
 */
public enum AssignmentOperator {
	ASSIGN("<-", null),
	ADD("+<-", "+"),
	SUB("-<-", "-"),
	MUL("*<-", "*"),
	DIV("/<-", "/"),
	MOD("%<-", "%"),
	AND("&<-", "&"),
	OR("|<-", "|"),
	XOR("^<-", "^"),
	SHL("<<<-", "<<"),
	SHR(">><-", ">>");

	private final String symbol;
	private final String binaryOperator;

	AssignmentOperator(String symbol, String binaryOperator) {
		this.symbol = symbol;
		this.binaryOperator = binaryOperator;
	}

	public String getSymbol() {
		return symbol;
	}

	/**
	 * @return the C binary operator applied by a compound assignment, or null for plain assignment
	 */
	public String getBinaryOperator() {
		return binaryOperator;
	}

	public boolean isCompound() {
		return binaryOperator != null;
	}

	public static AssignmentOperator fromSymbol(String symbol) {
		for (AssignmentOperator op : values()) {
			if (op.symbol.equals(symbol)) {
				return op;
			}
		}
		throw new IllegalArgumentException("unknown assignment operator " + symbol);
	}

	/**
	 * @return the compound form applying the given C binary operator, if the language has one
	 */
	public static Optional<AssignmentOperator> fromBinaryOperator(String binaryOperator) {
		for (AssignmentOperator op : values()) {
			if (op.isCompound() && op.binaryOperator.equals(binaryOperator)) {
				return Optional.of(op);
			}
		}
		return Optional.empty();
	}
}
