package org.javai.martial.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A transition of the graph, contributed by one action of one sequence.
 */
@JsonPropertyOrder({ "from", "to", "action", "sequence" })
public record Edge(StateRoleNode from, StateRoleNode to, String action, String sequence) {

	@JsonIgnore
	public boolean isSelfLoop() {
		return from.equals(to);
	}

	@Override
	public String toString() {
		return from + " -" + action + "-> " + to + " (" + sequence + ")";
	}
}
