package shaderir.ir;

/**
 * Binary operators. Every operator renders as exactly one fixed token.
 */
public enum Op {
	ADD("+"),
	SUB("-"),
	MUL("*"),
	DIV("/"),
	MOD("%"),
	LEFT_SHIFT("<<"),
	RIGHT_SHIFT(">>"),
	LESS_THAN("<"),
	LESS_EQUAL("<="),
	GREATER_THAN(">"),
	GREATER_EQUAL(">="),
	EQ("=="),
	NOT_EQUAL("!="),
	AND("&"),
	XOR("^"),
	OR("|"),
	AND_AND("&&"),
	OR_OR("||");

	private final String token;

	Op(String token) {
		this.token = token;
	}

	public String getToken() {
		return token;
	}
}
