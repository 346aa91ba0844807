package org.javai.martial.lang;

/**
 * Malformed input encountered by the tokenizer.
 *
 * @param character the offending character, a whole code point
 */
public record LexError(Kind kind, String character, SourcePosition position, String message) implements CompileError {

	public enum Kind {
		UNEXPECTED_CHARACTER
	}

	public static LexError unexpectedCharacter(int codePoint, SourcePosition position) {
		String character = Character.toString(codePoint);
		return new LexError(Kind.UNEXPECTED_CHARACTER, character, position,
				"Unexpected character '" + character + "'");
	}

	@Override
	public String describe() {
		return "Lex error [" + kind + "] at " + position + ": " + message;
	}
}
