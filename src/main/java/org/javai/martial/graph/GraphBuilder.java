package org.javai.martial.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.javai.martial.lang.Declaration.SequenceStep;
import org.javai.martial.lang.Declaration.StateRef;
import org.javai.martial.semantic.MartialSystem;
import org.javai.martial.semantic.Sequence;
import org.javai.martial.semantic.State;

/**
 * Derives the transition graph of a validated system.
 * <p>
 * This is the only place where open role compatibility is materialized, always
 * against the system's final merged role set.
 */
public final class GraphBuilder {

	private GraphBuilder() {
	}

	public static MartialGraph build(MartialSystem system) {
		Objects.requireNonNull(system, "system must not be null");
		return new MartialGraph(system.name(), buildNodes(system), buildEdges(system));
	}

	private static List<StateRoleNode> buildNodes(MartialSystem system) {
		Set<String> roles = system.roles();
		List<StateRoleNode> nodes = new ArrayList<>();
		for (State state : system.states().values()) {
			for (String role : roles) {
				if (state.isCompatibleWith(role, roles)) {
					nodes.add(new StateRoleNode(state.name(), role));
				}
			}
		}
		return nodes;
	}

	private static List<Edge> buildEdges(MartialSystem system) {
		List<Edge> edges = new ArrayList<>();
		for (Sequence sequence : system.sequences().values()) {
			for (SequenceStep step : sequence.steps()) {
				edges.add(new Edge(node(step.from()), node(step.to()), step.action(), sequence.name()));
			}
		}
		return edges;
	}

	private static StateRoleNode node(StateRef ref) {
		return new StateRoleNode(ref.state(), ref.role());
	}
}
