package org.javai.martial.semantic;

import java.util.List;
import org.javai.martial.lang.SourcePosition;

/**
 * Named cluster of states. Organizational metadata only; neither validation of
 * sequences nor the graph consult group membership.
 */
public record Group(String name, List<String> states, SourcePosition position) {

	public Group {
		states = List.copyOf(states);
	}

	public boolean contains(String state) {
		return states.contains(state);
	}
}
