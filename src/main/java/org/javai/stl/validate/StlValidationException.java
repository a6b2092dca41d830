package org.javai.stl.validate;

import java.util.List;
import java.util.stream.Collectors;
import org.javai.stl.StlCompilationException;

/**
 * Exception thrown when a formula is well-formed but not meaningful for a signal
 * catalog or a monitor. Carries every error found; the position is that of the first.
 */
public class StlValidationException extends StlCompilationException {

	private final List<ValidationError> errors;

	public StlValidationException(List<ValidationError> errors) {
		super(describe(errors), errors.isEmpty() ? -1 : errors.get(0).position());
		this.errors = List.copyOf(errors);
	}

	public StlValidationException(ValidationError error) {
		this(List.of(error));
	}

	public List<ValidationError> errors() {
		return errors;
	}

	private static String describe(List<ValidationError> errors) {
		if (errors.isEmpty()) {
			throw new IllegalArgumentException("At least one validation error is required");
		}
		return errors.stream()
				.map(error -> error.position() >= 0
						? error.message() + " at position " + error.position()
						: error.message())
				.collect(Collectors.joining("; "));
	}
}
