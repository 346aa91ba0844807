package org.javai.martial.lang;

/**
 * Thrown when the tokenizer meets a character that starts no token.
 */
public class LexException extends MartialException {

	private final LexError error;

	public LexException(LexError error) {
		super(error.describe());
		this.error = error;
	}

	@Override
	public LexError error() {
		return error;
	}
}
