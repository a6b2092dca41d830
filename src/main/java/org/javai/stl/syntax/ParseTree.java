package org.javai.stl.syntax;

import java.util.List;

/**
 * Node of the concrete parse tree produced by {@link StlParser}.
 * <p>
 * A node is either a terminal wrapping a single token, or a rule node carrying the
 * token that introduced it (the operator, the opening bracket, or the first token of
 * a predicate) and its children in source order. Parentheses are kept as
 * {@link Rule#PARENTHESIZED} nodes; they only disappear when the tree is reduced to
 * the formula AST.
 */
public record ParseTree(Rule rule, StlToken token, List<ParseTree> children) {

	public enum Rule {
		SPECIFICATION,
		PARENTHESIZED,
		NEGATION,
		NEXT,
		FUTURE,
		GLOBALLY,
		UNTIL,
		RELEASE,
		LOGICAL,
		PROPOSITIONAL,
		PREDICATE,
		INTERVAL,
		TERMINAL
	}

	public ParseTree {
		children = children != null ? List.copyOf(children) : List.of();
	}

	/**
	 * Creates a rule node.
	 */
	public static ParseTree rule(Rule rule, StlToken token, List<ParseTree> children) {
		return new ParseTree(rule, token, children);
	}

	/**
	 * Creates a terminal node.
	 */
	public static ParseTree terminal(StlToken token) {
		return new ParseTree(Rule.TERMINAL, token, List.of());
	}

	public boolean isTerminal() {
		return rule == Rule.TERMINAL;
	}

	public ParseTree child(int index) {
		return children.get(index);
	}

	/**
	 * Accepts a visitor and dispatches to the appropriate visitor method.
	 *
	 * @param <R> the return type of the visitor
	 * @param visitor the visitor to accept
	 * @return the result of the visitor operation
	 */
	public <R> R accept(ParseTreeVisitor<R> visitor) {
		if (isTerminal()) {
			return visitor.visitTerminal(token);
		}
		return visitor.visitRule(rule, token, children);
	}
}
