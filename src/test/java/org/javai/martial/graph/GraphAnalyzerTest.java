package org.javai.martial.graph;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import java.util.Set;
import org.javai.martial.testsupport.TestSystems;
import org.junit.jupiter.api.Test;

class GraphAnalyzerTest {

	private static final StateRoleNode A = new StateRoleNode("A", "R");
	private static final StateRoleNode B = new StateRoleNode("B", "R");
	private static final StateRoleNode C = new StateRoleNode("C", "R");

	/**
	 * Nodes A, B, C with the single edge A -> B.
	 */
	private static MartialGraph abc() {
		return GraphBuilder.build(TestSystems.validSystem("abc", """
				roles { R }
				state A
				state B
				state C
				sequence Only:
				    Go: A[R] -> B[R]
				"""));
	}

	@Test
	void reachabilityFollowsEdgesForward() {
		MartialGraph graph = abc();

		assertThat(GraphAnalyzer.reachableFrom(graph, List.of(A))).containsExactly(A, B);
		assertThat(GraphAnalyzer.unreachableFrom(graph, List.of(A))).containsExactly(C);
	}

	@Test
	void reachabilityDoesNotFollowEdgesBackward() {
		assertThat(GraphAnalyzer.reachableFrom(abc(), List.of(B))).containsExactly(B);
	}

	@Test
	void entryNodesOutsideGraphAreIgnored() {
		StateRoleNode stranger = new StateRoleNode("Nowhere", "R");

		assertThat(GraphAnalyzer.reachableFrom(abc(), List.of(stranger))).isEmpty();
	}

	@Test
	void reachabilityHandlesCycles() {
		MartialGraph graph = GraphBuilder.build(TestSystems.validSystem("cycle", """
				roles { R }
				state A
				state B
				state C
				sequence Round:
				    One: A[R] -> B[R]
				    Two: B[R] -> C[R]
				    Three: C[R] -> A[R]
				"""));

		assertThat(GraphAnalyzer.reachableFrom(graph, Set.of(C))).containsExactly(A, B, C);
	}

	@Test
	void sourcesSinksAndIsolatedNodes() {
		MartialGraph graph = abc();

		assertThat(GraphAnalyzer.sourceNodes(graph)).containsExactly(A, C);
		assertThat(GraphAnalyzer.sinkNodes(graph)).containsExactly(B, C);
		assertThat(GraphAnalyzer.isolatedNodes(graph)).containsExactly(C);
	}

	@Test
	void degreesCountEveryParallelEdge() {
		MartialGraph graph = GraphBuilder.build(TestSystems.validSystem("multi", """
				roles { R }
				state A
				state B
				sequence One:
				    Sweep: A[R] -> B[R]
				sequence Two:
				    Roll: A[R] -> B[R]
				"""));

		assertThat(GraphAnalyzer.outdegree(graph)).containsEntry(A, 2).containsEntry(B, 0);
		assertThat(GraphAnalyzer.indegree(graph)).containsEntry(A, 0).containsEntry(B, 2);
		assertThat(GraphAnalyzer.outgoingEdges(graph).get(A)).extracting(Edge::action).containsExactly("Sweep", "Roll");
		assertThat(GraphAnalyzer.outgoingEdges(graph, A)).extracting(Edge::sequence).containsExactly("One", "Two");
		assertThat(GraphAnalyzer.outgoingEdges(graph, B)).isEmpty();
	}

	@Test
	void selfLoopCountForSingleSelfLoop() {
		MartialGraph graph = GraphBuilder.build(TestSystems.validSystem("loop", """
				roles { Top }
				state Mount
				sequence Finish:
				    Ezekiel: Mount[Top] -> Mount[Top]
				"""));

		assertThat(GraphAnalyzer.selfLoopCount(graph)).isEqualTo(1);
		// a self-loop is both an incoming and an outgoing edge
		assertThat(GraphAnalyzer.sourceNodes(graph)).isEmpty();
		assertThat(GraphAnalyzer.sinkNodes(graph)).isEmpty();
	}

	@Test
	void statisticsSummarizeGraph() {
		GraphStatistics stats = GraphAnalyzer.statistics(abc());

		assertThat(stats.nodeCount()).isEqualTo(3);
		assertThat(stats.edgeCount()).isEqualTo(1);
		assertThat(stats.selfLoops()).isZero();
		assertThat(stats.sourceNodes()).containsExactly(A);
		assertThat(stats.sinkNodes()).containsExactly(B);
		assertThat(stats.isolatedNodes()).containsExactly(C);
	}

	@Test
	void statisticsLeaveSelfLoopingNodeUnclassified() {
		MartialGraph graph = GraphBuilder.build(TestSystems.validSystem("loop", """
				roles { Top }
				state Mount
				state Standing
				sequence Finish:
				    Ezekiel: Mount[Top] -> Mount[Top]
				"""));

		GraphStatistics stats = GraphAnalyzer.statistics(graph);

		assertThat(stats.sourceNodes()).isEmpty();
		assertThat(stats.sinkNodes()).isEmpty();
		assertThat(stats.isolatedNodes()).containsExactly(new StateRoleNode("Standing", "Top"));
	}

	@Test
	void analysesLeaveGraphUnchanged() {
		MartialGraph graph = abc();
		MartialGraph copy = new MartialGraph(graph.systemName(), graph.nodes(), graph.edges());

		GraphAnalyzer.statistics(graph);
		GraphAnalyzer.reachableFrom(graph, List.of(A));
		GraphAnalyzer.outgoingEdges(graph).clear();

		assertThat(graph).isEqualTo(copy);
	}
}
