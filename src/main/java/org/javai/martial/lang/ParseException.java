package org.javai.martial.lang;

/**
 * Thrown when a token sequence violates the martial grammar.
 */
public class ParseException extends MartialException {

	private final ParseError error;

	public ParseException(ParseError error) {
		super(error.describe());
		this.error = error;
	}

	@Override
	public ParseError error() {
		return error;
	}
}
