package org.javai.stl.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Utility class for walking {@link Formula} trees.
 */
public final class Formulas {

	private Formulas() {
		// Utility class - no instantiation
	}

	/**
	 * Visits every node of the tree in pre-order (node before its operands, operands
	 * left to right).
	 */
	public static void walkPreOrder(Formula formula, Consumer<Formula> visitor) {
		if (formula == null) {
			return;
		}
		visitor.accept(formula);
		for (Formula operand : formula.operands()) {
			walkPreOrder(operand, visitor);
		}
	}

	/**
	 * All predicate leaves in left-to-right order, including repeated occurrences.
	 */
	public static List<Formula.Predicate> predicates(Formula formula) {
		List<Formula.Predicate> predicates = new ArrayList<>();
		walkPreOrder(formula, node -> {
			if (node instanceof Formula.Predicate) {
				predicates.add((Formula.Predicate) node);
			}
		});
		return predicates;
	}

	/**
	 * Number of nodes in the tree.
	 */
	public static int size(Formula formula) {
		int[] count = {0};
		walkPreOrder(formula, node -> count[0]++);
		return count[0];
	}
}
