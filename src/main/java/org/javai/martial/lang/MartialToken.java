package org.javai.martial.lang;

/**
 * Represents a token of the martial language.
 *
 * @param type the token type
 * @param value the literal text of the token
 * @param position where the token starts
 */
public record MartialToken(TokenType type, String value, SourcePosition position) {

	public enum TokenType {
		IDENTIFIER("identifier"),
		ROLES("'roles'"),
		STATE("'state'"),
		SEQUENCE("'sequence'"),
		GROUP("'group'"),
		LBRACE("'{'"),
		RBRACE("'}'"),
		LBRACKET("'['"),
		RBRACKET("']'"),
		COMMA("','"),
		COLON("':'"),
		ARROW("'->'"),
		EOF("end of input");

		private final String description;

		TokenType(String description) {
			this.description = description;
		}

		public String description() {
			return description;
		}
	}

	@Override
	public String toString() {
		return switch (type) {
			case IDENTIFIER -> "IDENTIFIER(" + value + ")";
			case EOF -> "EOF";
			default -> type + "(" + value + ")";
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	/**
	 * Human-readable form used in "expected X, found Y" messages.
	 */
	public String describe() {
		return switch (type) {
			case IDENTIFIER -> "identifier '" + value + "'";
			default -> type.description();
		};
	}
}
