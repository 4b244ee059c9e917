package com.architecture.flowlayout.service.layout;

import com.architecture.flowlayout.dto.flow.FlowDocument;
import com.architecture.flowlayout.dto.flow.FlowMetadata;
import com.architecture.flowlayout.dto.flow.FlowTransition;
import com.architecture.flowlayout.dto.flow.GatewayType;
import com.architecture.flowlayout.dto.layout.NodeKind;
import com.architecture.flowlayout.exception.FlowReferenceException;
import com.architecture.flowlayout.model.graph.FlowGraph;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.architecture.flowlayout.service.layout.LayoutFixtures.activity;
import static com.architecture.flowlayout.service.layout.LayoutFixtures.gateway;
import static com.architecture.flowlayout.service.layout.LayoutFixtures.role;
import static com.architecture.flowlayout.service.layout.LayoutFixtures.transition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowGraphBuilderTest {

    private final FlowGraphBuilder builder = new FlowGraphBuilder();

    @Test
    void placesActivitiesBeforeGateways_andKeepsTransitionOrder() {
        FlowDocument document = FlowDocument.builder()
                .metadata(FlowMetadata.builder().id("p-1").title("Expense claim").build())
                .roles(List.of(role("clerk"), role("manager")))
                .gateways(List.of(gateway("g1")))
                .activities(List.of(activity("a1", "clerk"), activity("a2", "manager")))
                .transitions(List.of(
                        transition("t1", "a1", "g1"),
                        FlowTransition.builder().id("t2").source("g1").target("a2")
                                .condition("approved").name("ok").build()))
                .build();

        FlowGraph graph = builder.build(document);

        assertThat(graph.getFlowId()).isEqualTo("p-1");
        assertThat(graph.nodeCount()).isEqualTo(3);
        assertThat(graph.nodeId(0)).isEqualTo("a1");
        assertThat(graph.nodeId(1)).isEqualTo("a2");
        assertThat(graph.nodeId(2)).isEqualTo("g1");
        assertThat(graph.kind(2)).isEqualTo(NodeKind.GATEWAY);
        assertThat(graph.gatewayType(2)).isEqualTo(GatewayType.EXCLUSIVE);
        assertThat(graph.roleIndex(1)).isEqualTo(1);
        assertThat(graph.edgeId(0)).isEqualTo("t1");
        assertThat(graph.edgeLabel(1)).isEqualTo("approved");
        assertThat(graph.outDegree(2)).isEqualTo(1);
        assertThat(graph.target(graph.outEdge(2, 0))).isEqualTo(1);
    }

    @Test
    void failsWithReferenceError_whenTargetIsUnknown() {
        FlowDocument document = FlowDocument.builder()
                .activities(List.of(activity("a1", null)))
                .transitions(List.of(transition("t9", "a1", "ghost")))
                .build();

        assertThatThrownBy(() -> builder.build(document))
                .isInstanceOf(FlowReferenceException.class)
                .hasMessageContaining("t9")
                .satisfies(ex -> {
                    FlowReferenceException ref = (FlowReferenceException) ex;
                    assertThat(ref.getTransitionId()).isEqualTo("t9");
                    assertThat(ref.getMissingNodeId()).isEqualTo("ghost");
                });
    }

    @Test
    void failsWithReferenceError_whenSourceIsUnknown() {
        FlowDocument document = FlowDocument.builder()
                .activities(List.of(activity("a1", null)))
                .transitions(List.of(transition("t1", "nowhere", "a1")))
                .build();

        assertThatThrownBy(() -> builder.build(document))
                .isInstanceOf(FlowReferenceException.class)
                .extracting("missingNodeId")
                .isEqualTo("nowhere");
    }

    @Test
    void rejectsDuplicateNodeIds() {
        FlowDocument document = FlowDocument.builder()
                .activities(List.of(activity("a1", null)))
                .gateways(List.of(gateway("a1")))
                .build();

        assertThatThrownBy(() -> builder.build(document))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("a1");
    }

    @Test
    void buildsEmptyGraph_fromEmptyDocument() {
        FlowGraph graph = builder.build(new FlowDocument());

        assertThat(graph.isEmpty()).isTrue();
        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    void resolvesUnknownRoleToMinusOne() {
        FlowDocument document = FlowDocument.builder()
                .roles(List.of(role("clerk")))
                .activities(List.of(activity("a1", "auditor")))
                .build();

        FlowGraph graph = builder.build(document);

        assertThat(graph.roleIndex(0)).isEqualTo(-1);
        assertThat(graph.roleRef(0)).isEqualTo("auditor");
    }
}
