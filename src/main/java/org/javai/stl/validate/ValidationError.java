package org.javai.stl.validate;

import java.util.Objects;
import org.javai.stl.ast.Interval;
import org.javai.stl.signal.SignalType;

/**
 * Structured semantic error found in a formula. Positions are character offsets in the
 * requirement text, or {@code -1} when the formula was built in code.
 */
public sealed interface ValidationError {

	int position();

	String message();

	/**
	 * A predicate names a signal that the catalog does not declare.
	 */
	record UndeclaredVariable(String name, int position) implements ValidationError {

		public UndeclaredVariable {
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public String message() {
			return "Undeclared signal '" + name + "'";
		}
	}

	/**
	 * An interval whose lower bound is infinite or not strictly below its upper bound.
	 */
	record InvalidInterval(Interval interval, int position) implements ValidationError {

		public InvalidInterval {
			Objects.requireNonNull(interval, "interval must not be null");
		}

		@Override
		public String message() {
			return "Invalid interval " + interval + ": lower bound must be finite and below the upper bound";
		}
	}

	/**
	 * A bare name used for a real-valued signal, or a comparison applied to a boolean one.
	 */
	record TypeMismatch(String name, SignalType declared, int position) implements ValidationError {

		public TypeMismatch {
			Objects.requireNonNull(name, "name must not be null");
			Objects.requireNonNull(declared, "declared must not be null");
		}

		@Override
		public String message() {
			return declared == SignalType.BOOL
					? "Signal '" + name + "' is declared bool and cannot be compared with a threshold"
					: "Signal '" + name + "' is declared float and needs a comparison";
		}
	}

	/**
	 * A construct the selected monitor cannot evaluate.
	 */
	record UnsupportedOperator(String operator, MonitorBackend backend, int position) implements ValidationError {

		public UnsupportedOperator {
			Objects.requireNonNull(operator, "operator must not be null");
			Objects.requireNonNull(backend, "backend must not be null");
		}

		@Override
		public String message() {
			return "Operator '" + operator + "' is not supported by the " + backend.label() + " monitor";
		}
	}

	/**
	 * A signal name that the selected monitor reserves for its own use.
	 */
	record ReservedName(String name, MonitorBackend backend, int position) implements ValidationError {

		public ReservedName {
			Objects.requireNonNull(name, "name must not be null");
			Objects.requireNonNull(backend, "backend must not be null");
		}

		@Override
		public String message() {
			return "Signal name '" + name + "' is reserved by the " + backend.label() + " monitor";
		}
	}
}
