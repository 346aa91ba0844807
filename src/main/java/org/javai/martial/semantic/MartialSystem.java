package org.javai.martial.semantic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A validated martial system: every file of one directory merged into a single model.
 * <p>
 * Only {@link SemanticAnalyzer} creates instances, and only when no error was found.
 * All collections are unmodifiable and iterate in declaration order.
 */
public record MartialSystem(
		String name,
		Set<String> roles,
		Map<String, State> states,
		Map<String, Sequence> sequences,
		Map<String, Group> groups
) {

	public MartialSystem {
		roles = Collections.unmodifiableSet(new LinkedHashSet<>(roles));
		states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
		sequences = Collections.unmodifiableMap(new LinkedHashMap<>(sequences));
		groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
	}

	public Optional<State> state(String stateName) {
		return Optional.ofNullable(states.get(stateName));
	}

	public Optional<Sequence> sequence(String sequenceName) {
		return Optional.ofNullable(sequences.get(sequenceName));
	}

	/**
	 * Group name to member state names, for clustering by downstream consumers.
	 */
	public Map<String, List<String>> groupMembership() {
		Map<String, List<String>> membership = new LinkedHashMap<>();
		groups.forEach((groupName, group) -> membership.put(groupName, group.states()));
		return Collections.unmodifiableMap(membership);
	}
}
