package org.javai.martial.graph;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A vertex of the transition graph: a state occupied in a particular role.
 */
@JsonPropertyOrder({ "state", "role" })
public record StateRoleNode(String state, String role) {

	/**
	 * Textual id of the node, e.g. {@code Mount[Top]}.
	 */
	public String id() {
		return state + "[" + role + "]";
	}

	@Override
	public String toString() {
		return id();
	}
}
