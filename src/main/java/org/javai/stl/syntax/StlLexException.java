package org.javai.stl.syntax;

import org.javai.stl.StlCompilationException;

/**
 * Thrown when the tokenizer meets a character that cannot start or continue any token.
 */
public class StlLexException extends StlCompilationException {

	private final char character;

	public StlLexException(String message, int position, char character) {
		super(message, position);
		this.character = character;
	}

	public char character() {
		return character;
	}
}
