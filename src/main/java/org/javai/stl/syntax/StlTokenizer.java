package org.javai.stl.syntax;

import static org.javai.stl.syntax.StlToken.TokenType.ANDOP;
import static org.javai.stl.syntax.StlToken.TokenType.COMMA;
import static org.javai.stl.syntax.StlToken.TokenType.EQUALITYOP;
import static org.javai.stl.syntax.StlToken.TokenType.EQUIVOP;
import static org.javai.stl.syntax.StlToken.TokenType.FUTUREOP;
import static org.javai.stl.syntax.StlToken.TokenType.GLOBALLYOP;
import static org.javai.stl.syntax.StlToken.TokenType.IMPLIESOP;
import static org.javai.stl.syntax.StlToken.TokenType.INF;
import static org.javai.stl.syntax.StlToken.TokenType.LBRACK;
import static org.javai.stl.syntax.StlToken.TokenType.LPAREN;
import static org.javai.stl.syntax.StlToken.TokenType.MINUS;
import static org.javai.stl.syntax.StlToken.TokenType.NEGATION;
import static org.javai.stl.syntax.StlToken.TokenType.NEXTOP;
import static org.javai.stl.syntax.StlToken.TokenType.OROP;
import static org.javai.stl.syntax.StlToken.TokenType.RBRACK;
import static org.javai.stl.syntax.StlToken.TokenType.RELEASEOP;
import static org.javai.stl.syntax.StlToken.TokenType.RELOP;
import static org.javai.stl.syntax.StlToken.TokenType.RPAREN;
import static org.javai.stl.syntax.StlToken.TokenType.UNTILOP;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tokenizer for the STL requirement language.
 * Converts a requirement string into a stream of tokens terminated by {@code EOF}.
 * <p>
 * Operator words and {@code inf} are recognised only when a whole identifier spells
 * them, so {@code X1} or {@code info} remain signal names while {@code X_} is the
 * alternate spelling of {@code next}.
 */
public class StlTokenizer {

	private static final Map<String, StlToken.TokenType> KEYWORDS = Map.ofEntries(
			Map.entry("not", NEGATION),
			Map.entry("and", ANDOP),
			Map.entry("or", OROP),
			Map.entry("implies", IMPLIESOP),
			Map.entry("iff", EQUIVOP),
			Map.entry("next", NEXTOP),
			Map.entry("X", NEXTOP),
			Map.entry("X_", NEXTOP),
			Map.entry("finally", FUTUREOP),
			Map.entry("eventually", FUTUREOP),
			Map.entry("F", FUTUREOP),
			Map.entry("globally", GLOBALLYOP),
			Map.entry("always", GLOBALLYOP),
			Map.entry("G", GLOBALLYOP),
			Map.entry("until", UNTILOP),
			Map.entry("U", UNTILOP),
			Map.entry("release", RELEASEOP),
			Map.entry("R", RELEASEOP),
			Map.entry("inf", INF));

	// Longest spellings first
	private static final List<Symbol> SYMBOLS = List.of(
			new Symbol("<->", EQUIVOP),
			new Symbol("/\\", ANDOP),
			new Symbol("\\/", OROP),
			new Symbol("&&", ANDOP),
			new Symbol("||", OROP),
			new Symbol("->", IMPLIESOP),
			new Symbol("<>", FUTUREOP),
			new Symbol("[]", GLOBALLYOP),
			new Symbol("<=", RELOP),
			new Symbol(">=", RELOP),
			new Symbol("==", EQUALITYOP),
			new Symbol("!=", EQUALITYOP),
			new Symbol("&", ANDOP),
			new Symbol("|", OROP),
			new Symbol("~", NEGATION),
			new Symbol("!", NEGATION),
			new Symbol("<", RELOP),
			new Symbol(">", RELOP),
			new Symbol("-", MINUS),
			new Symbol("(", LPAREN),
			new Symbol(")", RPAREN),
			new Symbol("[", LBRACK),
			new Symbol("]", RBRACK),
			new Symbol(",", COMMA));

	private final String input;
	private int pos = 0;

	public StlTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws StlLexException if a character cannot be tokenized
	 */
	public List<StlToken> tokenize() {
		List<StlToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new StlToken(StlToken.TokenType.EOF, "", pos));
		return tokens;
	}

	/**
	 * Whether the word is an operator spelling or {@code inf}, and so can never be
	 * used as a signal name.
	 */
	public static boolean isReservedWord(String word) {
		return KEYWORDS.containsKey(word);
	}

	private StlToken nextToken() {
		char c = peek();

		if (startsNumber(c)) {
			return scanNumber();
		}
		if (isLetter(c)) {
			return scanWord();
		}
		for (Symbol symbol : SYMBOLS) {
			if (input.startsWith(symbol.text(), pos)) {
				int start = pos;
				pos += symbol.text().length();
				return new StlToken(symbol.type(), symbol.text(), start);
			}
		}
		throw new StlLexException("Unexpected character: '" + c + "' at position " + pos, pos, c);
	}

	private boolean startsNumber(char c) {
		if (isDigit(c)) {
			return true;
		}
		if (c == '.') {
			return isDigit(peekAt(pos + 1));
		}
		if (c == '-') {
			char next = peekAt(pos + 1);
			return isDigit(next) || (next == '.' && isDigit(peekAt(pos + 2)));
		}
		return false;
	}

	private StlToken scanNumber() {
		int start = pos;

		if (peek() == '-') {
			advance();
		}

		int digitsStart = pos;
		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}
		int integerDigits = pos - digitsStart;

		if (!isAtEnd() && peek() == '.') {
			advance(); // consume '.'
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}
		else if (integerDigits > 1 && input.charAt(digitsStart) == '0') {
			int offending = digitsStart + 1;
			throw new StlLexException("Integer literal '" + input.substring(start, pos)
					+ "' has a leading zero at position " + offending, offending, input.charAt(offending));
		}

		String value = input.substring(start, pos);
		if (Double.isInfinite(Double.parseDouble(value))) {
			throw new StlLexException("Number literal at position " + start + " is out of range",
					start, input.charAt(start));
		}
		return new StlToken(StlToken.TokenType.NUMBER, value, start);
	}

	private StlToken scanWord() {
		int start = pos;

		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		StlToken.TokenType keyword = KEYWORDS.get(value);
		return new StlToken(keyword != null ? keyword : StlToken.TokenType.IDENTIFIER, value, start);
	}

	private void skipWhitespace() {
		while (!isAtEnd() && isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return peekAt(pos);
	}

	private char peekAt(int index) {
		return index < input.length() ? input.charAt(index) : '\0';
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r';
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private boolean isIdentifierChar(char c) {
		return isLetter(c) || isDigit(c) || c == '_';
	}

	private record Symbol(String text, StlToken.TokenType type) {
	}
}
