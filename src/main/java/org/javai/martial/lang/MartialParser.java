package org.javai.martial.lang;

import java.util.ArrayList;
import java.util.List;
import org.javai.martial.lang.Declaration.GroupDeclaration;
import org.javai.martial.lang.Declaration.RolesDeclaration;
import org.javai.martial.lang.Declaration.SequenceDeclaration;
import org.javai.martial.lang.Declaration.SequenceStep;
import org.javai.martial.lang.Declaration.StateDeclaration;
import org.javai.martial.lang.Declaration.StateRef;
import org.javai.martial.lang.MartialToken.TokenType;

/**
 * Recursive-descent parser for martial source files.
 * <p>
 * Converts the tokens of one file into its declarations. The parser uses a single
 * token of lookahead and stops at the first syntax error. It never checks whether
 * referenced roles or states exist; that is left to semantic analysis, which sees
 * every file of a system at once.
 *
 * <pre>
 * file        := declaration*
 * declaration := roles | state | sequence | group
 * roles       := "roles" "{" ID ("," ID)* "}"
 * state       := "state" ID [ "roles" "{" ID ("," ID)* "}" ]
 * sequence    := "sequence" ID ":" step+
 * step        := ID ":" stateref "->" stateref
 * stateref    := ID "[" ID "]"
 * group       := "group" ID "{" [ ID ("," ID)* ] "}"
 * </pre>
 */
public class MartialParser {

	private final String fileId;
	private final List<MartialToken> tokens;
	private int current = 0;
	private int openBlocks = 0;

	public MartialParser(String fileId, List<MartialToken> tokens) {
		this.fileId = fileId;
		this.tokens = tokens != null ? tokens : List.of();
	}

	public MartialParser(List<MartialToken> tokens) {
		this("<input>", tokens);
	}

	/**
	 * Parses the tokens into the file's declarations.
	 *
	 * @return the parsed file (possibly without declarations)
	 * @throws ParseException at the first structural violation
	 */
	public MartialFile parse() {
		current = 0;
		openBlocks = 0;
		List<Declaration> declarations = new ArrayList<>();

		while (!isAtEnd()) {
			declarations.add(parseDeclaration());
		}

		return new MartialFile(fileId, declarations);
	}

	private Declaration parseDeclaration() {
		MartialToken token = peek();

		return switch (token.type()) {
			case ROLES -> parseRoles();
			case STATE -> parseState();
			case SEQUENCE -> parseSequence();
			case GROUP -> parseGroup();
			default -> throw error(ParseError.Kind.UNEXPECTED_TOKEN, "declaration ('roles', 'state', 'sequence' or 'group')");
		};
	}

	private RolesDeclaration parseRoles() {
		MartialToken keyword = expect(TokenType.ROLES);
		List<String> roles = parseIdentifierBlock(false);
		return new RolesDeclaration(roles, keyword.position());
	}

	private StateDeclaration parseState() {
		MartialToken keyword = expect(TokenType.STATE);
		String name = expectIdentifier();

		List<String> allowedRoles = null;
		if (check(TokenType.ROLES)) {
			advance();
			allowedRoles = parseIdentifierBlock(false);
		}

		return new StateDeclaration(name, allowedRoles, keyword.position());
	}

	private SequenceDeclaration parseSequence() {
		MartialToken keyword = expect(TokenType.SEQUENCE);
		String name = expectIdentifier();
		expect(TokenType.COLON);

		List<SequenceStep> steps = new ArrayList<>();
		steps.add(parseStep());

		// the body ends at the first token that cannot start another step
		while (check(TokenType.IDENTIFIER)) {
			steps.add(parseStep());
		}

		return new SequenceDeclaration(name, steps, keyword.position());
	}

	private SequenceStep parseStep() {
		MartialToken action = peek();
		String actionName = expectIdentifier();
		expect(TokenType.COLON);
		StateRef from = parseStateRef();
		expect(TokenType.ARROW);
		StateRef to = parseStateRef();
		return new SequenceStep(actionName, from, to, action.position());
	}

	private StateRef parseStateRef() {
		MartialToken stateToken = peek();
		String state = expectIdentifier();

		if (!check(TokenType.LBRACKET)) {
			throw error(ParseError.Kind.MISSING_NODE_ROLE, "'[' followed by a role after state '" + state + "'");
		}
		advance();
		String role = expectIdentifier();
		expect(TokenType.RBRACKET);

		return new StateRef(state, role, stateToken.position());
	}

	private GroupDeclaration parseGroup() {
		MartialToken keyword = expect(TokenType.GROUP);
		String name = expectIdentifier();
		List<String> states = parseIdentifierBlock(true);
		return new GroupDeclaration(name, states, keyword.position());
	}

	/**
	 * Parses {@code "{" ID ("," ID)* "}"}. Empty braces are accepted only when
	 * {@code allowEmpty} is set.
	 */
	private List<String> parseIdentifierBlock(boolean allowEmpty) {
		expect(TokenType.LBRACE);
		openBlocks++;

		List<String> identifiers = new ArrayList<>();
		if (!(allowEmpty && check(TokenType.RBRACE))) {
			identifiers.add(expectIdentifier());
			while (check(TokenType.COMMA)) {
				advance();
				identifiers.add(expectIdentifier());
			}
		}

		expect(TokenType.RBRACE);
		openBlocks--;
		return identifiers;
	}

	private MartialToken expect(TokenType type) {
		if (check(type)) {
			return advance();
		}
		throw error(ParseError.Kind.UNEXPECTED_TOKEN, type.description());
	}

	private String expectIdentifier() {
		return expect(TokenType.IDENTIFIER).value();
	}

	private ParseException error(ParseError.Kind kind, String expected) {
		MartialToken found = peek();
		if (found.isType(TokenType.EOF) && openBlocks > 0) {
			kind = ParseError.Kind.UNTERMINATED_BLOCK;
		}
		return new ParseException(ParseError.of(kind, expected, found));
	}

	private MartialToken peek() {
		if (current >= tokens.size()) {
			SourcePosition last = tokens.isEmpty()
					? new SourcePosition(fileId, 1, 1)
					: tokens.get(tokens.size() - 1).position();
			return new MartialToken(TokenType.EOF, "", last);
		}
		return tokens.get(current);
	}

	private MartialToken advance() {
		MartialToken token = peek();
		if (!isAtEnd()) {
			current++;
		}
		return token;
	}

	private boolean check(TokenType type) {
		return peek().type() == type;
	}

	private boolean isAtEnd() {
		return peek().type() == TokenType.EOF;
	}
}
