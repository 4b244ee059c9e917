package com.architecture.flowlayout.service.layout;

import com.architecture.flowlayout.dto.flow.GatewayType;
import com.architecture.flowlayout.model.graph.FlowGraph;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FeedbackEdgeDetectorTest {

    private final FeedbackEdgeDetector detector = new FeedbackEdgeDetector();

    @Test
    void findsNoFeedback_inAcyclicFlow() {
        FlowGraph graph = FlowGraph.builder()
                .addActivity("a", "A", null)
                .addActivity("b", "B", null)
                .addActivity("c", "C", null)
                .addEdge("t1", "a", "b", null)
                .addEdge("t2", "a", "c", null)
                .addEdge("t3", "b", "c", null)
                .build();

        FeedbackEdges feedback = detector.detect(graph);

        assertThat(feedback.count()).isZero();
    }

    @Test
    void marksEdgeBackToEarlierStep_andReportsItsCycle() {
        FlowGraph graph = FlowGraph.builder()
                .addActivity("submit", "Submit", null)
                .addActivity("review", "Review", null)
                .addActivity("reject", "Reject", null)
                .addEdge("t1", "submit", "review", null)
                .addEdge("t2", "review", "reject", null)
                .addEdge("t3", "reject", "submit", null)
                .build();

        FeedbackEdges feedback = detector.detect(graph);

        assertThat(feedback.inDiscoveryOrder()).containsExactly(2);
        assertThat(feedback.isFeedback(0)).isFalse();
        assertThat(feedback.cycle(0)).containsExactly(0, 1, 2, 0);
    }

    @Test
    void treatsSelfLoopAsFeedback() {
        FlowGraph graph = FlowGraph.builder()
                .addActivity("a", "A", null)
                .addActivity("b", "B", null)
                .addEdge("t1", "a", "b", null)
                .addEdge("retry", "b", "b", null)
                .build();

        FeedbackEdges feedback = detector.detect(graph);

        assertThat(feedback.inDiscoveryOrder()).containsExactly(1);
        assertThat(feedback.cycle(0)).containsExactly(1, 1);
    }

    @Test
    void cutsLoopAtEdgeReturningToTheStartRoot() {
        // "b" comes first in index order but "a" is the only node without predecessors
        FlowGraph graph = FlowGraph.builder()
                .addActivity("b", "B", null)
                .addActivity("a", "A", null)
                .addGateway("g", "Loop?", GatewayType.EXCLUSIVE)
                .addEdge("t1", "a", "b", null)
                .addEdge("t2", "b", "g", null)
                .addEdge("t3", "g", "b", "again")
                .build();

        FeedbackEdges feedback = detector.detect(graph);

        assertThat(feedback.count()).isEqualTo(1);
        assertThat(feedback.isFeedback(2)).isTrue();
    }

    @Test
    void handlesGraphWhereEveryNodeIsOnACycle() {
        FlowGraph graph = FlowGraph.builder()
                .addActivity("a", "A", null)
                .addActivity("b", "B", null)
                .addEdge("t1", "a", "b", null)
                .addEdge("t2", "b", "a", null)
                .build();

        FeedbackEdges feedback = detector.detect(graph);

        assertThat(feedback.inDiscoveryOrder()).containsExactly(1);
    }

    @Test
    void survivesLongChainsWithoutRecursion() {
        FlowGraph.Builder builder = FlowGraph.builder();
        int length = 20_000;
        for (int i = 0; i < length; i++) {
            builder.addActivity("n" + i, null, null);
        }
        for (int i = 1; i < length; i++) {
            builder.addEdge("t" + i, "n" + (i - 1), "n" + i, null);
        }
        builder.addEdge("back", "n" + (length - 1), "n0", null);

        FeedbackEdges feedback = detector.detect(builder.build());

        assertThat(feedback.count()).isEqualTo(1);
        assertThat(feedback.cycle(0)).hasSize(length + 1);
    }
}
