package org.javai.stl.ast;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.javai.stl.syntax.StlTokenizer;

/**
 * Abstract syntax tree of an STL formula. Sealed to ensure all formula kinds are known.
 * <p>
 * Nodes are immutable records that own their operands, so a formula is an acyclic tree
 * with structural equality: two requirements that differ only in operator spelling,
 * whitespace or redundant parentheses produce equal formulas. Source positions are
 * deliberately not part of a node; see {@link SourceMap}.
 * <p>
 * Temporal operators take an optional {@link Interval}; {@code null} means the
 * operator quantifies over all time.
 */
public sealed interface Formula {

	/**
	 * Direct sub-formulas, left to right.
	 */
	List<Formula> operands();

	/**
	 * Every formula other than a {@link Predicate}.
	 */
	sealed interface Compound extends Formula {

		Operator operator();

		/**
		 * Time window of a temporal operator, {@code null} when unbounded or not temporal.
		 */
		default Interval interval() {
			return null;
		}
	}

	/**
	 * Atomic proposition over one named signal.
	 * <p>
	 * Either a comparison {@code name relop threshold} (optionally written
	 * {@code -name relop threshold}, recorded by {@code negatedName}), or a bare
	 * {@code name} referring to a boolean signal, in which case {@code relop} and
	 * {@code threshold} are {@code null}.
	 */
	record Predicate(String name, Relop relop, Double threshold, boolean negatedName) implements Formula {

		private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z]+[A-Za-z0-9_]*");

		public Predicate {
			Objects.requireNonNull(name, "name must not be null");
			if (!IDENTIFIER.matcher(name).matches() || StlTokenizer.isReservedWord(name)) {
				throw new IllegalArgumentException("Not a valid signal name: '" + name + "'");
			}
			if ((relop == null) != (threshold == null)) {
				throw new IllegalArgumentException("A comparison needs both an operator and a threshold: " + name);
			}
			if (negatedName && relop == null) {
				throw new IllegalArgumentException("A negated signal name requires a comparison: " + name);
			}
			if (threshold != null) {
				if (threshold.isNaN() || threshold.isInfinite()) {
					throw new IllegalArgumentException("Threshold must be finite: " + threshold);
				}
				if (threshold == 0.0) {
					threshold = 0.0;
				}
			}
		}

		public static Predicate signal(String name) {
			return new Predicate(name, null, null, false);
		}

		public static Predicate compare(String name, Relop relop, double threshold) {
			return new Predicate(name, relop, threshold, false);
		}

		public static Predicate negated(String name, Relop relop, double threshold) {
			return new Predicate(name, relop, threshold, true);
		}

		public boolean isBoolean() {
			return relop == null;
		}

		@Override
		public List<Formula> operands() {
			return List.of();
		}
	}

	record Not(Formula operand) implements Compound {

		public Not {
			Objects.requireNonNull(operand, "operand must not be null");
		}

		@Override
		public Operator operator() {
			return Operator.NOT;
		}

		@Override
		public List<Formula> operands() {
			return List.of(operand);
		}
	}

	record And(Formula left, Formula right) implements Compound {

		public And {
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public Operator operator() {
			return Operator.AND;
		}

		@Override
		public List<Formula> operands() {
			return List.of(left, right);
		}
	}

	record Or(Formula left, Formula right) implements Compound {

		public Or {
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public Operator operator() {
			return Operator.OR;
		}

		@Override
		public List<Formula> operands() {
			return List.of(left, right);
		}
	}

	record Implies(Formula left, Formula right) implements Compound {

		public Implies {
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public Operator operator() {
			return Operator.IMPLIES;
		}

		@Override
		public List<Formula> operands() {
			return List.of(left, right);
		}
	}

	record Equiv(Formula left, Formula right) implements Compound {

		public Equiv {
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public Operator operator() {
			return Operator.EQUIV;
		}

		@Override
		public List<Formula> operands() {
			return List.of(left, right);
		}
	}

	record Next(Interval interval, Formula operand) implements Compound {

		public Next {
			Objects.requireNonNull(operand, "operand must not be null");
		}

		@Override
		public Operator operator() {
			return Operator.NEXT;
		}

		@Override
		public List<Formula> operands() {
			return List.of(operand);
		}
	}

	record Future(Interval interval, Formula operand) implements Compound {

		public Future {
			Objects.requireNonNull(operand, "operand must not be null");
		}

		@Override
		public Operator operator() {
			return Operator.FUTURE;
		}

		@Override
		public List<Formula> operands() {
			return List.of(operand);
		}
	}

	record Globally(Interval interval, Formula operand) implements Compound {

		public Globally {
			Objects.requireNonNull(operand, "operand must not be null");
		}

		@Override
		public Operator operator() {
			return Operator.GLOBALLY;
		}

		@Override
		public List<Formula> operands() {
			return List.of(operand);
		}
	}

	record Until(Interval interval, Formula left, Formula right) implements Compound {

		public Until {
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public Operator operator() {
			return Operator.UNTIL;
		}

		@Override
		public List<Formula> operands() {
			return List.of(left, right);
		}
	}

	record Release(Interval interval, Formula left, Formula right) implements Compound {

		public Release {
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public Operator operator() {
			return Operator.RELEASE;
		}

		@Override
		public List<Formula> operands() {
			return List.of(left, right);
		}
	}
}
