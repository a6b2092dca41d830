package org.javai.stl.ast;

/**
 * One end of a time {@link Interval}: either a finite time value or infinity.
 * Infinity is kept as its own variant rather than replaced by a large finite number.
 */
public sealed interface Bound {

	/**
	 * Canonical source spelling of this bound.
	 */
	String text();

	static Bound finite(double value) {
		return new Finite(value);
	}

	static Bound infinite() {
		return Infinite.INSTANCE;
	}

	record Finite(double value) implements Bound {

		public Finite {
			if (Double.isNaN(value) || Double.isInfinite(value)) {
				throw new IllegalArgumentException("Finite bound must be a finite number: " + value);
			}
			if (value == 0.0) {
				value = 0.0; // folds -0.0
			}
		}

		@Override
		public String text() {
			return Numbers.format(value);
		}
	}

	enum Infinite implements Bound {
		INSTANCE;

		@Override
		public String text() {
			return "inf";
		}
	}
}
