package org.javai.martial.graph;

import java.util.List;

/**
 * Summary figures of a graph.
 */
public record GraphStatistics(
		int nodeCount,
		int edgeCount,
		int selfLoops,
		List<StateRoleNode> sourceNodes,
		List<StateRoleNode> sinkNodes,
		List<StateRoleNode> isolatedNodes
) {

	public GraphStatistics {
		sourceNodes = List.copyOf(sourceNodes);
		sinkNodes = List.copyOf(sinkNodes);
		isolatedNodes = List.copyOf(isolatedNodes);
	}
}
