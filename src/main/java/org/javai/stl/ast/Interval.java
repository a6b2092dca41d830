package org.javai.stl.ast;

import java.util.Objects;

/**
 * Time window attached to a temporal operator.
 * <p>
 * The closed flags record the bracket characters used in the requirement: {@code [}
 * and {@code ]} are closed, {@code (} and {@code )} are open. Dense-time monitors
 * treat the two differently at the window edges, so they are never normalised.
 * <p>
 * The record itself accepts any pair of bounds; ordering is checked by the validator
 * so that it can report the offending position.
 */
public record Interval(Bound lower, boolean lowerClosed, Bound upper, boolean upperClosed) {

	public Interval {
		Objects.requireNonNull(lower, "lower must not be null");
		Objects.requireNonNull(upper, "upper must not be null");
	}

	public static Interval closed(double lower, double upper) {
		return new Interval(Bound.finite(lower), true, Bound.finite(upper), true);
	}

	/**
	 * {@code [lower, inf)}.
	 */
	public static Interval from(double lower) {
		return new Interval(Bound.finite(lower), true, Bound.infinite(), false);
	}

	public boolean isBounded() {
		return upper instanceof Bound.Finite;
	}

	/**
	 * Whether the bounds describe a non-empty window: a finite lower bound strictly
	 * below a finite upper bound, or a finite lower bound with an infinite upper one.
	 */
	public boolean isWellFormed() {
		if (!(lower instanceof Bound.Finite)) {
			return false;
		}
		if (upper instanceof Bound.Finite) {
			return ((Bound.Finite) lower).value() < ((Bound.Finite) upper).value();
		}
		return true;
	}

	@Override
	public String toString() {
		return (lowerClosed ? "[" : "(") + lower.text() + ", " + upper.text() + (upperClosed ? "]" : ")");
	}
}
