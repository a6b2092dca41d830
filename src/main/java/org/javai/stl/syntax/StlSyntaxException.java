package org.javai.stl.syntax;

import org.javai.stl.StlCompilationException;

/**
 * Exception thrown when a token sequence does not match the STL grammar.
 * <p>
 * The parser never recovers: the first mismatching token aborts the parse and is
 * reported together with a description of what the grammar expected at that point.
 */
public class StlSyntaxException extends StlCompilationException {

	private final String expected;
	private final StlToken found;

	public StlSyntaxException(String expected, StlToken found) {
		this(expected, found, "");
	}

	public StlSyntaxException(String expected, StlToken found, String hint) {
		super("Expected " + expected + " but found " + found.describe() + " at position " + found.position() + hint,
				found.position());
		this.expected = expected;
		this.found = found;
	}

	public String expected() {
		return expected;
	}

	public StlToken found() {
		return found;
	}
}
