package org.javai.martial.lang;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import org.javai.martial.lang.Declaration.GroupDeclaration;
import org.javai.martial.lang.Declaration.RolesDeclaration;
import org.javai.martial.lang.Declaration.SequenceDeclaration;
import org.javai.martial.lang.Declaration.SequenceStep;
import org.javai.martial.lang.Declaration.StateDeclaration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the martial parser. The parser is purely syntactic: references to
 * unknown roles or states must parse without complaint.
 */
@DisplayName("Martial parser")
class MartialParserTest {

	private static MartialFile parse(String input) {
		List<MartialToken> tokens = new MartialTokenizer("test.martial", input).tokenize();
		return new MartialParser("test.martial", tokens).parse();
	}

	private static ParseError parseError(String input) {
		try {
			parse(input);
		}
		catch (ParseException e) {
			return e.error();
		}
		throw new AssertionError("Expected a parse error for: " + input);
	}

	@Nested
	@DisplayName("Valid declarations")
	class ValidDeclarations {

		@Test
		void emptyFileHasNoDeclarations() {
			MartialFile file = parse("// only a comment\n");

			assertThat(file.fileId()).isEqualTo("test.martial");
			assertThat(file.declarations()).isEmpty();
		}

		@Test
		void parsesRolesBlock() {
			MartialFile file = parse("roles { Top, Bottom, Neutral }");

			assertThat(file.declarations()).singleElement()
					.isInstanceOfSatisfying(RolesDeclaration.class,
							roles -> assertThat(roles.roles()).containsExactly("Top", "Bottom", "Neutral"));
		}

		@Test
		void parsesStateWithoutRoleRestriction() {
			MartialFile file = parse("state Standing");

			StateDeclaration state = (StateDeclaration) file.declarations().get(0);
			assertThat(state.name()).isEqualTo("Standing");
			assertThat(state.explicitRoles()).isEmpty();
			assertThat(state.position()).isEqualTo(new SourcePosition("test.martial", 1, 1));
		}

		@Test
		void parsesStateWithRoleRestriction() {
			MartialFile file = parse("state Mount roles { Top, Bottom }");

			StateDeclaration state = (StateDeclaration) file.declarations().get(0);
			assertThat(state.name()).isEqualTo("Mount");
			assertThat(state.explicitRoles()).contains(List.of("Top", "Bottom"));
		}

		@Test
		void parsesSequenceSteps() {
			MartialFile file = parse("""
					sequence GuardPass:
					    Stack: ClosedGuard[Top] -> HalfGuard[Top]
					    KneeSlice: HalfGuard[Top] -> SideControl[Top]
					""");

			SequenceDeclaration sequence = (SequenceDeclaration) file.declarations().get(0);
			assertThat(sequence.name()).isEqualTo("GuardPass");
			assertThat(sequence.steps()).extracting(SequenceStep::action).containsExactly("Stack", "KneeSlice");

			SequenceStep first = sequence.steps().get(0);
			assertThat(first.from().state()).isEqualTo("ClosedGuard");
			assertThat(first.from().role()).isEqualTo("Top");
			assertThat(first.to().state()).isEqualTo("HalfGuard");
			assertThat(first.to().role()).isEqualTo("Top");
			assertThat(first.position()).isEqualTo(new SourcePosition("test.martial", 2, 5));
		}

		@Test
		void sequenceEndsAtNextKeyword() {
			MartialFile file = parse("""
					sequence Escape:
					    Shrimp: Mount[Bottom] -> HalfGuard[Bottom]
					state Mount
					""");

			assertThat(file.declarations()).hasSize(2);
			assertThat(((SequenceDeclaration) file.declarations().get(0)).steps()).hasSize(1);
			assertThat(file.declarations().get(1)).isInstanceOf(StateDeclaration.class);
		}

		@Test
		void parsesGroup() {
			MartialFile file = parse("group ClosedGuardFamily { ClosedGuard, WilliamsGuard, RubberGuard }");

			GroupDeclaration group = (GroupDeclaration) file.declarations().get(0);
			assertThat(group.name()).isEqualTo("ClosedGuardFamily");
			assertThat(group.states()).containsExactly("ClosedGuard", "WilliamsGuard", "RubberGuard");
		}

		@Test
		void emptyGroupIsSyntacticallyValid() {
			MartialFile file = parse("group Nothing { }");

			assertThat(((GroupDeclaration) file.declarations().get(0)).states()).isEmpty();
		}

		@Test
		void recordsUnresolvedReferencesVerbatim() {
			MartialFile file = parse("sequence S:\n  Teleport: Nowhere[Ghost] -> Elsewhere[Phantom]");

			SequenceStep step = ((SequenceDeclaration) file.declarations().get(0)).steps().get(0);
			assertThat(step.from().toString()).isEqualTo("Nowhere[Ghost]");
			assertThat(step.to().toString()).isEqualTo("Elsewhere[Phantom]");
		}

		@Test
		void parsesMixedDeclarationsInOrder() {
			MartialFile file = parse("""
					// BJJ example
					roles { Top, Bottom, Neutral }

					state Standing
					state Mount roles { Top, Bottom }

					sequence Takedown:
					    DoubleLeg: Standing[Neutral] -> Mount[Top]

					group Dominant { Mount }
					""");

			assertThat(file.declarations()).extracting(d -> d.getClass().getSimpleName())
					.containsExactly("RolesDeclaration", "StateDeclaration", "StateDeclaration",
							"SequenceDeclaration", "GroupDeclaration");
		}
	}

	@Nested
	@DisplayName("Syntax errors")
	class SyntaxErrors {

		@Test
		void unknownTopLevelToken() {
			ParseError error = parseError("Mount");

			assertThat(error.kind()).isEqualTo(ParseError.Kind.UNEXPECTED_TOKEN);
			assertThat(error.found()).isEqualTo("identifier 'Mount'");
			assertThat(error.expected()).contains("declaration");
		}

		@Test
		void missingCommaBetweenRoles() {
			ParseError error = parseError("roles { Top Bottom }");

			assertThat(error.kind()).isEqualTo(ParseError.Kind.UNEXPECTED_TOKEN);
			assertThat(error.expected()).isEqualTo("'}'");
			assertThat(error.found()).isEqualTo("identifier 'Bottom'");
			assertThat(error.position()).isEqualTo(new SourcePosition("test.martial", 1, 13));
		}

		@Test
		void emptyRolesBlockIsRejected() {
			ParseError error = parseError("roles { }");

			assertThat(error.kind()).isEqualTo(ParseError.Kind.UNEXPECTED_TOKEN);
			assertThat(error.expected()).isEqualTo("identifier");
		}

		@Test
		void endOfInputInsideRolesBlock() {
			ParseError error = parseError("roles { Top, Bottom");

			assertThat(error.kind()).isEqualTo(ParseError.Kind.UNTERMINATED_BLOCK);
			assertThat(error.found()).isEqualTo("end of input");
		}

		@Test
		void endOfInputInsideGroupBlock() {
			ParseError error = parseError("group G { A,");

			assertThat(error.kind()).isEqualTo(ParseError.Kind.UNTERMINATED_BLOCK);
		}

		@Test
		void stateReferenceWithoutRole() {
			ParseError error = parseError("sequence S:\n  Go: Mount -> Guard[Top]");

			assertThat(error.kind()).isEqualTo(ParseError.Kind.MISSING_NODE_ROLE);
			assertThat(error.found()).isEqualTo("'->'");
			assertThat(error.message()).contains("Mount");
		}

		@Test
		void sequenceWithoutSteps() {
			ParseError error = parseError("sequence Empty:\nstate Mount");

			assertThat(error.kind()).isEqualTo(ParseError.Kind.UNEXPECTED_TOKEN);
			assertThat(error.expected()).isEqualTo("identifier");
			assertThat(error.found()).isEqualTo("'state'");
		}

		@Test
		void missingArrowInStep() {
			ParseError error = parseError("sequence S:\n  Go: A[Top] B[Top]");

			assertThat(error.kind()).isEqualTo(ParseError.Kind.UNEXPECTED_TOKEN);
			assertThat(error.expected()).isEqualTo("'->'");
		}

		@Test
		void keywordCannotNameAState() {
			assertThatThrownBy(() -> parse("state group"))
					.isInstanceOf(ParseException.class)
					.hasMessageContaining("Expected identifier, found 'group'");
		}
	}
}
