package org.javai.martial.lang;

/**
 * Malformed token sequence encountered by the parser.
 *
 * @param kind what went wrong
 * @param expected description of what the grammar required
 * @param found description of the token actually present
 * @param position position of the offending token
 * @param message human-readable summary
 */
public record ParseError(Kind kind, String expected, String found, SourcePosition position, String message)
		implements CompileError {

	public enum Kind {
		UNEXPECTED_TOKEN,
		UNTERMINATED_BLOCK,
		MISSING_NODE_ROLE
	}

	public static ParseError of(Kind kind, String expected, MartialToken found) {
		String message = switch (kind) {
			case UNTERMINATED_BLOCK -> "Unterminated block: expected " + expected + " before end of input";
			case MISSING_NODE_ROLE -> "Missing role for state reference: expected " + expected + ", found " + found.describe();
			case UNEXPECTED_TOKEN -> "Expected " + expected + ", found " + found.describe();
		};
		return new ParseError(kind, expected, found.describe(), found.position(), message);
	}

	@Override
	public String describe() {
		return "Parse error [" + kind + "] at " + position + ": " + message;
	}
}
