package org.javai.martial.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural analyses over a {@link MartialGraph}.
 * <p>
 * Every method is a pure function of its arguments; the graph is never modified
 * and the analyses may be run in any order. Results that are node collections
 * follow the graph's node order.
 */
public final class GraphAnalyzer {

	private GraphAnalyzer() {
	}

	/**
	 * Nodes reachable from {@code entryNodes} by following edges forward. Entry
	 * nodes that belong to the graph are themselves reachable.
	 */
	public static Set<StateRoleNode> reachableFrom(MartialGraph graph, Collection<StateRoleNode> entryNodes) {
		Objects.requireNonNull(graph, "graph must not be null");
		Objects.requireNonNull(entryNodes, "entryNodes must not be null");

		Map<StateRoleNode, List<Edge>> adjacency = outgoingEdges(graph);
		Set<StateRoleNode> nodes = new HashSet<>(graph.nodes());
		Set<StateRoleNode> visited = new HashSet<>();
		Deque<StateRoleNode> toVisit = new ArrayDeque<>();
		for (StateRoleNode entry : entryNodes) {
			if (nodes.contains(entry)) {
				toVisit.push(entry);
			}
		}

		while (!toVisit.isEmpty()) {
			StateRoleNode current = toVisit.pop();
			if (!visited.add(current)) {
				continue;
			}
			for (Edge edge : adjacency.getOrDefault(current, List.of())) {
				if (!visited.contains(edge.to())) {
					toVisit.push(edge.to());
				}
			}
		}

		Set<StateRoleNode> ordered = new LinkedHashSet<>();
		for (StateRoleNode node : graph.nodes()) {
			if (visited.contains(node)) {
				ordered.add(node);
			}
		}
		return Collections.unmodifiableSet(ordered);
	}

	/**
	 * Nodes that cannot be reached from {@code entryNodes}.
	 */
	public static List<StateRoleNode> unreachableFrom(MartialGraph graph, Collection<StateRoleNode> entryNodes) {
		Set<StateRoleNode> reachable = reachableFrom(graph, entryNodes);
		return graph.nodes().stream()
				.filter(node -> !reachable.contains(node))
				.toList();
	}

	/**
	 * Nodes without incoming edges.
	 */
	public static List<StateRoleNode> sourceNodes(MartialGraph graph) {
		Map<StateRoleNode, Integer> indegree = indegree(graph);
		return graph.nodes().stream()
				.filter(node -> indegree.get(node) == 0)
				.toList();
	}

	/**
	 * Nodes without outgoing edges.
	 */
	public static List<StateRoleNode> sinkNodes(MartialGraph graph) {
		Map<StateRoleNode, Integer> outdegree = outdegree(graph);
		return graph.nodes().stream()
				.filter(node -> outdegree.get(node) == 0)
				.toList();
	}

	/**
	 * Nodes without any edge at all.
	 */
	public static List<StateRoleNode> isolatedNodes(MartialGraph graph) {
		Map<StateRoleNode, Integer> indegree = indegree(graph);
		Map<StateRoleNode, Integer> outdegree = outdegree(graph);
		return graph.nodes().stream()
				.filter(node -> indegree.get(node) == 0 && outdegree.get(node) == 0)
				.toList();
	}

	public static int selfLoopCount(MartialGraph graph) {
		return (int) graph.edges().stream().filter(Edge::isSelfLoop).count();
	}

	/**
	 * Number of incoming edges per node. Multi-edges count once each.
	 */
	public static Map<StateRoleNode, Integer> indegree(MartialGraph graph) {
		Map<StateRoleNode, Integer> degrees = zeroDegrees(graph);
		for (Edge edge : graph.edges()) {
			degrees.merge(edge.to(), 1, Integer::sum);
		}
		return Collections.unmodifiableMap(degrees);
	}

	/**
	 * Number of outgoing edges per node. Multi-edges count once each.
	 */
	public static Map<StateRoleNode, Integer> outdegree(MartialGraph graph) {
		Map<StateRoleNode, Integer> degrees = zeroDegrees(graph);
		for (Edge edge : graph.edges()) {
			degrees.merge(edge.from(), 1, Integer::sum);
		}
		return Collections.unmodifiableMap(degrees);
	}

	/**
	 * Outgoing edges grouped by their source node, in edge order.
	 */
	public static Map<StateRoleNode, List<Edge>> outgoingEdges(MartialGraph graph) {
		Map<StateRoleNode, List<Edge>> adjacency = new LinkedHashMap<>();
		for (Edge edge : graph.edges()) {
			adjacency.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
		}
		return adjacency;
	}

	/**
	 * Edges leaving {@code node}, in edge order. Empty for sinks and for nodes
	 * outside the graph.
	 */
	public static List<Edge> outgoingEdges(MartialGraph graph, StateRoleNode node) {
		Objects.requireNonNull(node, "node must not be null");
		return graph.edges().stream()
				.filter(edge -> edge.from().equals(node))
				.toList();
	}

	/**
	 * Summary figures of the graph. Unlike {@link #sourceNodes} and {@link #sinkNodes},
	 * the summary keeps the three classes disjoint: a source has outgoing edges,
	 * a sink has incoming edges, and a node with neither is only isolated.
	 */
	public static GraphStatistics statistics(MartialGraph graph) {
		Map<StateRoleNode, Integer> indegree = indegree(graph);
		Map<StateRoleNode, Integer> outdegree = outdegree(graph);
		List<StateRoleNode> sources = new ArrayList<>();
		List<StateRoleNode> sinks = new ArrayList<>();
		List<StateRoleNode> isolated = new ArrayList<>();
		for (StateRoleNode node : graph.nodes()) {
			int in = indegree.get(node);
			int out = outdegree.get(node);
			if (in == 0 && out == 0) {
				isolated.add(node);
			}
			else if (in == 0) {
				sources.add(node);
			}
			else if (out == 0) {
				sinks.add(node);
			}
		}
		return new GraphStatistics(
				graph.nodes().size(),
				graph.edges().size(),
				selfLoopCount(graph),
				sources,
				sinks,
				isolated);
	}

	private static Map<StateRoleNode, Integer> zeroDegrees(MartialGraph graph) {
		Map<StateRoleNode, Integer> degrees = new LinkedHashMap<>();
		for (StateRoleNode node : graph.nodes()) {
			degrees.put(node, 0);
		}
		return degrees;
	}
}
