package org.javai.stl.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.javai.stl.ast.Formula;
import org.javai.stl.ast.Interval;
import org.javai.stl.ast.Operator;

/**
 * The operator structure of a formula with its predicates replaced by backend-specific
 * leaves: indices into a predicate table, or resolved column references.
 *
 * @param <L> the leaf type
 */
public sealed interface OperatorTree<L> {

	record Leaf<L>(L value) implements OperatorTree<L> {

		public Leaf {
			Objects.requireNonNull(value, "value must not be null");
		}
	}

	/**
	 * @param operator the formula kind
	 * @param interval the time window, {@code null} when unbounded or not temporal
	 * @param operands sub-trees, left to right
	 */
	record Node<L>(Operator operator, Interval interval, List<OperatorTree<L>> operands) implements OperatorTree<L> {

		public Node {
			Objects.requireNonNull(operator, "operator must not be null");
			operands = List.copyOf(operands);
			if (operands.size() != operator.arity()) {
				throw new IllegalArgumentException(
						operator + " takes " + operator.arity() + " operand(s) but got " + operands.size());
			}
		}
	}

	/**
	 * Builds the tree of a formula, mapping predicates to leaves in left-to-right order.
	 */
	static <L> OperatorTree<L> of(Formula formula, Function<Formula.Predicate, L> leaves) {
		if (formula instanceof Formula.Predicate predicate) {
			return new Leaf<>(leaves.apply(predicate));
		}
		Formula.Compound compound = (Formula.Compound) formula;
		List<OperatorTree<L>> operands = new ArrayList<>();
		for (Formula operand : compound.operands()) {
			operands.add(of(operand, leaves));
		}
		return new Node<>(compound.operator(), compound.interval(), operands);
	}

	/**
	 * Leaf values in left-to-right order.
	 */
	default List<L> leaves() {
		List<L> values = new ArrayList<>();
		collectLeaves(this, values);
		return values;
	}

	private static <L> void collectLeaves(OperatorTree<L> tree, List<L> values) {
		if (tree instanceof Leaf<L> leaf) {
			values.add(leaf.value());
			return;
		}
		for (OperatorTree<L> operand : ((Node<L>) tree).operands()) {
			collectLeaves(operand, values);
		}
	}
}
