package org.javai.stl.syntax;

import java.util.List;

/**
 * Visitor interface for traversing {@link ParseTree}s.
 *
 * @param <R> the return type of the visitor operations
 */
public interface ParseTreeVisitor<R> {

	/**
	 * Visits a rule node.
	 *
	 * @param rule the grammar rule the node was produced by
	 * @param token the token that introduced the rule
	 * @param children the child nodes in source order
	 * @return the result of visiting this node
	 */
	R visitRule(ParseTree.Rule rule, StlToken token, List<ParseTree> children);

	/**
	 * Visits a terminal node.
	 *
	 * @param token the wrapped token
	 * @return the result of visiting this node
	 */
	R visitTerminal(StlToken token);
}
