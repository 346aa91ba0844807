package org.javai.martial.semantic;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.javai.martial.lang.SourcePosition;

/**
 * A registered state.
 * <p>
 * A state without an explicit role list is compatible with every role of the
 * system. That rule is evaluated on demand against whatever role set the caller
 * passes in, so it always reflects the fully merged set.
 *
 * @param name the state identifier
 * @param explicitRoles the declared role restriction, or {@code null} for open compatibility
 * @param position where the state was declared
 */
public record State(String name, List<String> explicitRoles, SourcePosition position) {

	public State {
		explicitRoles = explicitRoles != null ? List.copyOf(explicitRoles) : null;
	}

	public boolean hasExplicitRoles() {
		return explicitRoles != null;
	}

	public Optional<List<String>> roleRestriction() {
		return Optional.ofNullable(explicitRoles);
	}

	public boolean isCompatibleWith(String role, Collection<String> systemRoles) {
		if (!systemRoles.contains(role)) {
			return false;
		}
		return explicitRoles == null || explicitRoles.contains(role);
	}

	/**
	 * The roles of {@code systemRoles} this state accepts, in the iteration order of
	 * {@code systemRoles}.
	 */
	public List<String> compatibleRoles(Collection<String> systemRoles) {
		return systemRoles.stream()
				.filter(role -> isCompatibleWith(role, systemRoles))
				.toList();
	}
}
