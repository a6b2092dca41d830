package org.javai.stl.translate;

import java.util.List;
import java.util.Objects;

/**
 * A predicate in normalised linear form {@code coefficients · x <= threshold}.
 *
 * @param name the signal the predicate was written over
 * @param coefficients one entry per trace column
 * @param threshold the right-hand side
 */
public record LinearPredicate(String name, List<Double> coefficients, double threshold) {

	public LinearPredicate {
		Objects.requireNonNull(name, "name must not be null");
		coefficients = List.copyOf(coefficients);
	}
}
