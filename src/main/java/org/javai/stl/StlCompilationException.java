package org.javai.stl;

/**
 * Base exception for every failure raised while compiling an STL requirement.
 * <p>
 * Each subclass belongs to one compilation stage (lexing, parsing, validation) and
 * carries the zero-based character offset in the requirement text that the failure
 * refers to, or {@code -1} when the failure cannot be tied to a source location.
 */
public class StlCompilationException extends RuntimeException {

	private final int position;

	public StlCompilationException(String message, int position) {
		super(message);
		this.position = position;
	}

	public StlCompilationException(String message, int position, Throwable cause) {
		super(message, cause);
		this.position = position;
	}

	/**
	 * Character offset of the offending input, or {@code -1} if unknown.
	 */
	public int position() {
		return position;
	}
}
