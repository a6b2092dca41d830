package org.javai.stl.translate;

import java.util.List;
import java.util.Objects;
import org.javai.stl.validate.MonitorBackend;

/**
 * Output of a backend translator, ready to hand to a robustness monitor.
 */
public sealed interface CompiledSpecification {

	MonitorBackend backend();

	/**
	 * The signals the monitor must read from the trace.
	 */
	List<VariableBinding> variables();

	/**
	 * Dense-time form: a table of linear predicates and an operator skeleton whose
	 * leaves index into it.
	 *
	 * @param variables every declared signal in declaration order
	 * @param dimension length of every coefficient row
	 * @param predicates one entry per predicate occurrence, left to right
	 * @param skeleton the operator tree with predicate indices as leaves
	 */
	record LinearSpecification(List<VariableBinding> variables, int dimension, List<LinearPredicate> predicates,
			OperatorTree<Integer> skeleton) implements CompiledSpecification {

		public LinearSpecification {
			variables = List.copyOf(variables);
			predicates = List.copyOf(predicates);
			Objects.requireNonNull(skeleton, "skeleton must not be null");
		}

		@Override
		public MonitorBackend backend() {
			return MonitorBackend.LINEAR_CONSTRAINT;
		}
	}

	/**
	 * Discrete-time form: the formula tree with resolved predicates and the declaration
	 * table of the signals it references, in first-encounter order.
	 */
	record TreeSpecification(List<VariableBinding> declarations, OperatorTree<ResolvedPredicate> tree)
			implements CompiledSpecification {

		public TreeSpecification {
			declarations = List.copyOf(declarations);
			Objects.requireNonNull(tree, "tree must not be null");
		}

		@Override
		public MonitorBackend backend() {
			return MonitorBackend.TREE_WALKING;
		}

		@Override
		public List<VariableBinding> variables() {
			return declarations;
		}
	}
}
