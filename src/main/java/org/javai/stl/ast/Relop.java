package org.javai.stl.ast;

/**
 * Relational operators allowed in an STL predicate.
 */
public enum Relop {

	LT("<"),
	GT(">"),
	LE("<="),
	GE(">=");

	private final String symbol;

	Relop(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}

	public boolean isStrict() {
		return this == LT || this == GT;
	}

	/**
	 * True for {@code <} and {@code <=}, the operators already in {@code x <= c} form.
	 */
	public boolean isUpperBound() {
		return this == LT || this == LE;
	}

	public static Relop fromSymbol(String symbol) {
		for (Relop relop : values()) {
			if (relop.symbol.equals(symbol)) {
				return relop;
			}
		}
		throw new IllegalArgumentException("Unknown relational operator: " + symbol);
	}
}
