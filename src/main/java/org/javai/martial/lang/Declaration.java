package org.javai.martial.lang;

import java.util.List;
import java.util.Optional;

/**
 * Top-level declaration of a martial source file.
 * <p>
 * Declarations are purely syntactic: names are recorded exactly as written and
 * nothing is resolved against other declarations.
 */
public sealed interface Declaration {

	SourcePosition position();

	<R> R accept(DeclarationVisitor<R> visitor);

	/**
	 * {@code roles { Top, Bottom }}
	 */
	record RolesDeclaration(List<String> roles, SourcePosition position) implements Declaration {
		public RolesDeclaration {
			roles = List.copyOf(roles);
		}

		@Override
		public <R> R accept(DeclarationVisitor<R> visitor) {
			return visitor.visitRoles(this);
		}
	}

	/**
	 * {@code state Mount roles { Top, Bottom }}; without the role list the state
	 * is compatible with every declared role.
	 */
	record StateDeclaration(String name, List<String> allowedRoles, SourcePosition position) implements Declaration {
		public StateDeclaration {
			allowedRoles = allowedRoles != null ? List.copyOf(allowedRoles) : null;
		}

		public Optional<List<String>> explicitRoles() {
			return Optional.ofNullable(allowedRoles);
		}

		@Override
		public <R> R accept(DeclarationVisitor<R> visitor) {
			return visitor.visitState(this);
		}
	}

	/**
	 * {@code sequence Name: Action: A[r] -> B[r] ...}
	 */
	record SequenceDeclaration(String name, List<SequenceStep> steps, SourcePosition position) implements Declaration {
		public SequenceDeclaration {
			steps = List.copyOf(steps);
		}

		@Override
		public <R> R accept(DeclarationVisitor<R> visitor) {
			return visitor.visitSequence(this);
		}
	}

	/**
	 * {@code group Name { StateA, StateB }}
	 */
	record GroupDeclaration(String name, List<String> states, SourcePosition position) implements Declaration {
		public GroupDeclaration {
			states = List.copyOf(states);
		}

		@Override
		public <R> R accept(DeclarationVisitor<R> visitor) {
			return visitor.visitGroup(this);
		}
	}

	/**
	 * One action of a sequence: {@code Action: From[role] -> To[role]}.
	 */
	record SequenceStep(String action, StateRef from, StateRef to, SourcePosition position) {
	}

	/**
	 * A state name immediately followed by a bracketed role name.
	 */
	record StateRef(String state, String role, SourcePosition position) {

		/**
		 * Structural equality ignoring where the reference was written.
		 */
		public boolean sameNode(StateRef other) {
			return state.equals(other.state) && role.equals(other.role);
		}

		@Override
		public String toString() {
			return state + "[" + role + "]";
		}
	}
}
