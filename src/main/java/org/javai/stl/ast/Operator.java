package org.javai.stl.ast;

/**
 * The non-leaf formula kinds, with the spelling used when a formula is printed
 * back to STL or translated to TPTL.
 */
public enum Operator {

	NOT("not", "!", 1),
	AND("and", "/\\", 2),
	OR("or", "\\/", 2),
	IMPLIES("implies", "->", 2),
	EQUIV("iff", "<->", 2),
	NEXT("next", "X", 1),
	FUTURE("eventually", "<>", 1),
	GLOBALLY("always", "[]", 1),
	UNTIL("until", "U", 2),
	RELEASE("release", "R", 2);

	private final String keyword;
	private final String tptlSymbol;
	private final int arity;

	Operator(String keyword, String tptlSymbol, int arity) {
		this.keyword = keyword;
		this.tptlSymbol = tptlSymbol;
		this.arity = arity;
	}

	/**
	 * Canonical STL spelling.
	 */
	public String keyword() {
		return keyword;
	}

	public String tptlSymbol() {
		return tptlSymbol;
	}

	public int arity() {
		return arity;
	}
}
