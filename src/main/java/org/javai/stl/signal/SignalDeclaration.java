package org.javai.stl.signal;

import java.util.List;
import java.util.Objects;

/**
 * Declares one signal that requirements may reference.
 *
 * @param name the name used in requirements
 * @param type the signal's data type
 * @param column the column of the signal in the trace state vector
 * @param coefficients optional user-supplied coefficient row for the linear-constraint
 *        backend; empty means a one-hot row at {@code column}
 * @param bound optional threshold used by the linear-constraint backend when the signal
 *        is referenced by bare name; {@code null} means {@code 0}
 */
public record SignalDeclaration(String name, SignalType type, int column, List<Double> coefficients, Double bound) {

	public SignalDeclaration {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Signal name cannot be null or empty");
		}
		if (column < 0) {
			throw new IllegalArgumentException("Column of signal '" + name + "' must not be negative: " + column);
		}
		type = type != null ? type : SignalType.FLOAT;
		coefficients = coefficients != null ? List.copyOf(coefficients) : List.of();
	}

	public static SignalDeclaration of(String name, SignalType type, int column) {
		return new SignalDeclaration(name, type, column, List.of(), null);
	}

	public static SignalDeclaration ofFloat(String name, int column) {
		return of(name, SignalType.FLOAT, column);
	}

	public boolean hasCoefficients() {
		return !coefficients.isEmpty();
	}

	/**
	 * Threshold for a bare-name reference in linear form.
	 */
	public double boundOrZero() {
		return Objects.requireNonNullElse(bound, 0.0);
	}
}
