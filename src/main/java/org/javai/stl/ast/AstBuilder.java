package org.javai.stl.ast;

import java.util.List;
import org.javai.stl.syntax.ParseTree;
import org.javai.stl.syntax.StlToken;
import org.javai.stl.syntax.StlToken.TokenType;

/**
 * Reduces a {@link ParseTree} to the {@link Formula} AST.
 * <p>
 * The reduction is purely structural: parenthesized groups collapse to their inner
 * formula, operator spellings collapse to one node kind, and number literals become
 * doubles. No names are resolved and no intervals are checked here. The position of
 * every node is recorded in the resulting {@link SourceMap}.
 */
public class AstBuilder {

	/**
	 * Builds the AST of a {@link ParseTree.Rule#SPECIFICATION} tree.
	 *
	 * @param source the requirement text the tree was parsed from
	 * @param tree the parse tree
	 * @return the formula with its source positions
	 */
	public ParsedFormula build(String source, ParseTree tree) {
		if (tree == null) {
			throw new IllegalArgumentException("Parse tree cannot be null");
		}
		SourceMap.Builder positions = SourceMap.builder();
		ParseTree root = tree.rule() == ParseTree.Rule.SPECIFICATION ? tree.child(0) : tree;
		Formula formula = reduce(root, positions);
		return new ParsedFormula(source, formula, positions.build());
	}

	private Formula reduce(ParseTree tree, SourceMap.Builder positions) {
		List<ParseTree> children = tree.children();
		int position = tree.token().position();

		Formula formula = switch (tree.rule()) {
			case PARENTHESIZED -> reduce(children.get(1), positions);
			case PREDICATE -> predicate(children);
			case NEGATION -> new Formula.Not(reduce(children.get(1), positions));
			case NEXT -> new Formula.Next(unaryInterval(children, positions), lastOperand(children, positions));
			case FUTURE -> new Formula.Future(unaryInterval(children, positions), lastOperand(children, positions));
			case GLOBALLY -> new Formula.Globally(unaryInterval(children, positions), lastOperand(children, positions));
			case UNTIL -> new Formula.Until(binaryInterval(children, positions),
					reduce(children.get(0), positions), lastOperand(children, positions));
			case RELEASE -> new Formula.Release(binaryInterval(children, positions),
					reduce(children.get(0), positions), lastOperand(children, positions));
			case LOGICAL -> logical(tree.token(), reduce(children.get(0), positions), reduce(children.get(2), positions));
			case PROPOSITIONAL -> propositional(tree.token(),
					reduce(children.get(0), positions), reduce(children.get(2), positions));
			default -> throw new IllegalArgumentException("Unexpected parse tree node: " + tree.rule());
		};

		if (tree.rule() == ParseTree.Rule.PARENTHESIZED) {
			return formula;
		}
		return positions.record(formula, position);
	}

	private Formula predicate(List<ParseTree> children) {
		boolean negated = children.get(0).token().isType(TokenType.MINUS);
		int offset = negated ? 1 : 0;
		String name = children.get(offset).token().value();
		if (children.size() == offset + 1) {
			return Formula.Predicate.signal(name);
		}
		Relop relop = Relop.fromSymbol(children.get(offset + 1).token().value());
		double threshold = number(children.get(offset + 2).token());
		return new Formula.Predicate(name, relop, threshold, negated);
	}

	private Formula logical(StlToken operator, Formula left, Formula right) {
		if (operator.isType(TokenType.ANDOP)) {
			return new Formula.And(left, right);
		}
		return new Formula.Or(left, right);
	}

	private Formula propositional(StlToken operator, Formula left, Formula right) {
		if (operator.isType(TokenType.IMPLIESOP)) {
			return new Formula.Implies(left, right);
		}
		return new Formula.Equiv(left, right);
	}

	private Formula lastOperand(List<ParseTree> children, SourceMap.Builder positions) {
		return reduce(children.get(children.size() - 1), positions);
	}

	// [op, interval?, operand]
	private Interval unaryInterval(List<ParseTree> children, SourceMap.Builder positions) {
		return children.size() == 3 ? interval(children.get(1), positions) : null;
	}

	// [left, op, interval?, right]
	private Interval binaryInterval(List<ParseTree> children, SourceMap.Builder positions) {
		return children.size() == 4 ? interval(children.get(2), positions) : null;
	}

	private Interval interval(ParseTree tree, SourceMap.Builder positions) {
		List<ParseTree> children = tree.children();
		boolean lowerClosed = children.get(0).token().isType(TokenType.LBRACK);
		boolean upperClosed = children.get(4).token().isType(TokenType.RBRACK);
		Interval interval = new Interval(
				bound(children.get(1).token()), lowerClosed,
				bound(children.get(3).token()), upperClosed);
		return positions.record(interval, tree.token().position());
	}

	private Bound bound(StlToken token) {
		if (token.isType(TokenType.INF)) {
			return Bound.infinite();
		}
		return Bound.finite(number(token));
	}

	private double number(StlToken token) {
		// "3." and ".14" are both accepted by Double.parseDouble
		return Double.parseDouble(token.value());
	}
}
