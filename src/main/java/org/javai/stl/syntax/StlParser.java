package org.javai.stl.syntax;

import java.util.ArrayList;
import java.util.List;
import org.javai.stl.syntax.ParseTree.Rule;
import org.javai.stl.syntax.StlToken.TokenType;

/**
 * Recursive-descent parser for STL requirements.
 * <p>
 * Precedence, from loosest to tightest binding:
 * <ol>
 *   <li>{@code implies}, {@code iff} (left-associative)</li>
 *   <li>{@code and}, {@code or} sharing one tier, associated left to right as authored</li>
 *   <li>{@code until}, {@code release} with an optional interval (left-associative)</li>
 *   <li>prefix {@code not}, {@code next}, {@code eventually}, {@code always}, each with an
 *       optional interval and binding to the immediately following operand</li>
 *   <li>parenthesized formulas and predicates</li>
 * </ol>
 * The whole token stream must be consumed; anything left before {@code EOF} is a
 * syntax error. There is no error recovery.
 *
 * <pre>
 * StlTokenizer tokenizer = new StlTokenizer("always[0, 10] (speed &lt;= 120)");
 * ParseTree tree = new StlParser(tokenizer.tokenize()).parse();
 * </pre>
 */
public class StlParser {

	private final List<StlToken> tokens;
	private int current = 0;

	/**
	 * Creates a parser over a token list as produced by {@link StlTokenizer}.
	 *
	 * @param tokens the tokens to parse; a missing trailing EOF token is added
	 */
	public StlParser(List<StlToken> tokens) {
		List<StlToken> copy = new ArrayList<>(tokens != null ? tokens : List.of());
		if (copy.isEmpty() || !copy.get(copy.size() - 1).isType(TokenType.EOF)) {
			int end = copy.isEmpty() ? 0 : copy.get(copy.size() - 1).position() + copy.get(copy.size() - 1).value().length();
			copy.add(new StlToken(TokenType.EOF, "", end));
		}
		this.tokens = List.copyOf(copy);
	}

	/**
	 * Parses the complete token stream into a specification parse tree.
	 *
	 * @return the root node, of rule {@link Rule#SPECIFICATION}
	 * @throws StlSyntaxException if the tokens do not form exactly one formula
	 */
	public ParseTree parse() {
		StlToken first = peek();
		ParseTree formula = parsePropositional();
		if (!check(TokenType.EOF)) {
			throw unexpected("end of input");
		}
		return ParseTree.rule(Rule.SPECIFICATION, first, List.of(formula));
	}

	private ParseTree parsePropositional() {
		ParseTree left = parseLogical();
		while (check(TokenType.IMPLIESOP) || check(TokenType.EQUIVOP)) {
			StlToken operator = advance();
			ParseTree right = parseLogical();
			left = ParseTree.rule(Rule.PROPOSITIONAL, operator, List.of(left, ParseTree.terminal(operator), right));
		}
		return left;
	}

	private ParseTree parseLogical() {
		ParseTree left = parseTemporal();
		while (check(TokenType.ANDOP) || check(TokenType.OROP)) {
			StlToken operator = advance();
			ParseTree right = parseTemporal();
			left = ParseTree.rule(Rule.LOGICAL, operator, List.of(left, ParseTree.terminal(operator), right));
		}
		return left;
	}

	private ParseTree parseTemporal() {
		ParseTree left = parseUnary();
		while (check(TokenType.UNTILOP) || check(TokenType.RELEASEOP)) {
			StlToken operator = advance();
			List<ParseTree> children = new ArrayList<>();
			children.add(left);
			children.add(ParseTree.terminal(operator));
			if (startsInterval()) {
				children.add(parseInterval());
			}
			children.add(parseUnary());
			Rule rule = operator.isType(TokenType.UNTILOP) ? Rule.UNTIL : Rule.RELEASE;
			left = ParseTree.rule(rule, operator, children);
		}
		return left;
	}

	private ParseTree parseUnary() {
		StlToken token = peek();
		if (token.isType(TokenType.NEGATION)) {
			advance();
			ParseTree operand = parseUnary();
			return ParseTree.rule(Rule.NEGATION, token, List.of(ParseTree.terminal(token), operand));
		}
		if (token.isType(TokenType.NEXTOP) || token.isType(TokenType.FUTUREOP) || token.isType(TokenType.GLOBALLYOP)) {
			advance();
			List<ParseTree> children = new ArrayList<>();
			children.add(ParseTree.terminal(token));
			if (startsInterval()) {
				children.add(parseInterval());
			}
			children.add(parseUnary());
			return ParseTree.rule(unaryTemporalRule(token.type()), token, children);
		}
		return parsePrimary();
	}

	private ParseTree parsePrimary() {
		if (check(TokenType.LPAREN)) {
			StlToken open = advance();
			ParseTree inner = parsePropositional();
			StlToken close = expect(TokenType.RPAREN, "')'");
			return ParseTree.rule(Rule.PARENTHESIZED, open,
					List.of(ParseTree.terminal(open), inner, ParseTree.terminal(close)));
		}
		if (check(TokenType.MINUS) || check(TokenType.IDENTIFIER)) {
			return parsePredicate();
		}
		throw unexpected("a formula");
	}

	private ParseTree parsePredicate() {
		StlToken first = peek();
		List<ParseTree> children = new ArrayList<>();
		boolean minus = check(TokenType.MINUS);
		if (minus) {
			children.add(ParseTree.terminal(advance()));
		}
		children.add(ParseTree.terminal(expect(TokenType.IDENTIFIER, "a signal name")));

		if (minus || check(TokenType.RELOP)) {
			children.add(ParseTree.terminal(expect(TokenType.RELOP, "a relational operator")));
			children.add(ParseTree.terminal(expect(TokenType.NUMBER, "a number")));
		}
		return ParseTree.rule(Rule.PREDICATE, first, children);
	}

	private ParseTree parseInterval() {
		StlToken open = advance();
		StlToken lower = expectBound();
		StlToken comma = expect(TokenType.COMMA, "','");
		StlToken upper = expectBound();
		StlToken close;
		if (check(TokenType.RPAREN) || check(TokenType.RBRACK)) {
			close = advance();
		}
		else {
			throw unexpected("')' or ']'");
		}
		return ParseTree.rule(Rule.INTERVAL, open, List.of(
				ParseTree.terminal(open),
				ParseTree.terminal(lower),
				ParseTree.terminal(comma),
				ParseTree.terminal(upper),
				ParseTree.terminal(close)));
	}

	/**
	 * A bracket always opens an interval after a temporal operator; a parenthesis only
	 * does when a bound follows, otherwise it groups the operand.
	 */
	private boolean startsInterval() {
		if (check(TokenType.LBRACK)) {
			return true;
		}
		if (check(TokenType.LPAREN)) {
			TokenType next = peekAhead(1).type();
			return next == TokenType.NUMBER || next == TokenType.INF;
		}
		return false;
	}

	private StlToken expectBound() {
		if (check(TokenType.NUMBER) || check(TokenType.INF)) {
			return advance();
		}
		throw unexpected("a number or 'inf'");
	}

	private static Rule unaryTemporalRule(TokenType type) {
		return switch (type) {
			case NEXTOP -> Rule.NEXT;
			case FUTUREOP -> Rule.FUTURE;
			case GLOBALLYOP -> Rule.GLOBALLY;
			default -> throw new IllegalArgumentException("Not a unary temporal operator: " + type);
		};
	}

	private StlToken expect(TokenType type, String description) {
		if (check(type)) {
			return advance();
		}
		throw unexpected(description);
	}

	private StlSyntaxException unexpected(String expected) {
		StlToken found = peek();
		if (found.isType(TokenType.EQUALITYOP)) {
			return new StlSyntaxException(expected, found, " (equality operators are reserved and cannot be used)");
		}
		return new StlSyntaxException(expected, found);
	}

	private boolean check(TokenType type) {
		return peek().isType(type);
	}

	private StlToken peek() {
		return tokens.get(current);
	}

	private StlToken peekAhead(int distance) {
		return tokens.get(Math.min(current + distance, tokens.size() - 1));
	}

	private StlToken advance() {
		StlToken token = tokens.get(current);
		if (!token.isType(TokenType.EOF)) {
			current++;
		}
		return token;
	}
}
