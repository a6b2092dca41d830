package org.javai.stl.syntax;

/**
 * Represents a token of the STL requirement language.
 *
 * @param type the token type
 * @param value the token text exactly as written in the requirement
 * @param position the character position in the input string
 */
public record StlToken(TokenType type, String value, int position) {

	public enum TokenType {
		LPAREN,        // (
		RPAREN,        // )
		LBRACK,        // [
		RBRACK,        // ]
		COMMA,         // ,
		MINUS,         // - in front of a predicate name
		NEGATION,      // ~ ! not
		RELOP,         // < > <= >=
		EQUALITYOP,    // == != (reserved, never parsed)
		NEXTOP,        // next X X_
		FUTUREOP,      // finally eventually F <>
		GLOBALLYOP,    // globally always G []
		UNTILOP,       // until U
		RELEASEOP,     // release R
		ANDOP,         // and /\ && &
		OROP,          // or \/ || |
		IMPLIESOP,     // implies ->
		EQUIVOP,       // iff <->
		INF,           // inf
		IDENTIFIER,    // signal names
		NUMBER,        // signed integers and decimals
		EOF            // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case EOF -> "EOF";
			case IDENTIFIER, NUMBER -> type + "(" + value + ")";
			default -> type + "('" + value + "')";
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	/**
	 * Human-readable rendering used in diagnostics.
	 */
	public String describe() {
		return type == TokenType.EOF ? "end of input" : "'" + value + "'";
	}
}
