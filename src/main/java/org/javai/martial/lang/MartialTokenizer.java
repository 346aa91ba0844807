package org.javai.martial.lang;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tokenizer for martial source files.
 * Converts the text of a single file into a list of tokens.
 */
public class MartialTokenizer {

	private static final Map<String, MartialToken.TokenType> KEYWORDS = Map.of(
			"roles", MartialToken.TokenType.ROLES,
			"state", MartialToken.TokenType.STATE,
			"sequence", MartialToken.TokenType.SEQUENCE,
			"group", MartialToken.TokenType.GROUP);

	private final String fileId;
	private final String input;
	private int pos = 0;
	private int line = 1;
	private int column = 1;

	public MartialTokenizer(String fileId, String input) {
		this.fileId = fileId != null ? fileId : "<input>";
		this.input = input != null ? input : "";
	}

	public MartialTokenizer(String input) {
		this("<input>", input);
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws LexException if a character starts no token
	 */
	public List<MartialToken> tokenize() {
		List<MartialToken> tokens = new ArrayList<>();
		pos = 0;
		line = 1;
		column = 1;

		while (true) {
			skipWhitespaceAndComments();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new MartialToken(MartialToken.TokenType.EOF, "", position()));
		return List.copyOf(tokens);
	}

	private MartialToken nextToken() {
		SourcePosition start = position();
		int c = peek();

		return switch (c) {
			case '{' -> single(MartialToken.TokenType.LBRACE, start);
			case '}' -> single(MartialToken.TokenType.RBRACE, start);
			case '[' -> single(MartialToken.TokenType.LBRACKET, start);
			case ']' -> single(MartialToken.TokenType.RBRACKET, start);
			case ',' -> single(MartialToken.TokenType.COMMA, start);
			case ':' -> single(MartialToken.TokenType.COLON, start);
			case '-' -> {
				if (peekNext() != '>') {
					throw new LexException(LexError.unexpectedCharacter(c, start));
				}
				advance();
				advance();
				yield new MartialToken(MartialToken.TokenType.ARROW, "->", start);
			}
			default -> {
				if (isIdentifierStart(c)) {
					yield scanIdentifier(start);
				}
				throw new LexException(LexError.unexpectedCharacter(c, start));
			}
		};
	}

	private MartialToken single(MartialToken.TokenType type, SourcePosition start) {
		int c = advance();
		return new MartialToken(type, Character.toString(c), start);
	}

	private MartialToken scanIdentifier(SourcePosition start) {
		int begin = pos;

		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}

		String value = input.substring(begin, pos);
		MartialToken.TokenType type = KEYWORDS.getOrDefault(value, MartialToken.TokenType.IDENTIFIER);
		return new MartialToken(type, value, start);
	}

	private void skipWhitespaceAndComments() {
		while (!isAtEnd()) {
			int c = peek();
			if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
				advance();
			}
			else if (c == '/' && peekNext() == '/') {
				// line comment
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			}
			else {
				return;
			}
		}
	}

	private SourcePosition position() {
		return new SourcePosition(fileId, line, column);
	}

	// Positions advance by code point so letters outside the BMP form one character.
	private int peek() {
		return isAtEnd() ? '\0' : input.codePointAt(pos);
	}

	private int peekNext() {
		if (isAtEnd()) {
			return '\0';
		}
		int next = pos + Character.charCount(input.codePointAt(pos));
		return next < input.length() ? input.codePointAt(next) : '\0';
	}

	private int advance() {
		int c = input.codePointAt(pos);
		pos += Character.charCount(c);
		if (c == '\n') {
			line++;
			column = 1;
		}
		else {
			column++;
		}
		return c;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isIdentifierStart(int c) {
		return Character.isLetter(c) || c == '_';
	}

	private boolean isIdentifierChar(int c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}
}
