package org.javai.martial.graph;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Transition graph derived from a validated system.
 * <p>
 * A pure value: it holds no reference to the system it came from and is never
 * updated in place. Build a new one with {@link GraphBuilder} when the system changes.
 *
 * @param systemName name of the source system
 * @param nodes every compatible (state, role) pair, states in declaration order then roles in declaration order
 * @param edges one edge per sequence step, sequences in declaration order then steps in order
 */
@JsonPropertyOrder({ "systemName", "nodes", "edges" })
public record MartialGraph(String systemName, List<StateRoleNode> nodes, List<Edge> edges) {

	public MartialGraph {
		nodes = List.copyOf(nodes);
		edges = List.copyOf(edges);
	}
}
