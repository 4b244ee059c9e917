package com.architecture.flowlayout.service.layout;

import com.architecture.flowlayout.dto.flow.FlowDocument;
import com.architecture.flowlayout.dto.layout.LayoutEdge;
import com.architecture.flowlayout.dto.layout.LayoutLane;
import com.architecture.flowlayout.dto.layout.LayoutMetadata;
import com.architecture.flowlayout.dto.layout.LayoutModel;
import com.architecture.flowlayout.dto.layout.LayoutNode;
import com.architecture.flowlayout.dto.layout.LayoutNote;
import com.architecture.flowlayout.dto.layout.LayoutPoint;
import com.architecture.flowlayout.dto.layout.LayoutRank;
import com.architecture.flowlayout.dto.layout.NodeKind;
import com.architecture.flowlayout.dto.layout.NoteType;
import com.architecture.flowlayout.model.graph.FlowGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the layout pipeline for one flow document:
 * graph model, feedback detection, layering, lanes, ordering, geometry, routing.
 *
 * Stateless; every call builds its own graph and intermediate results.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FlowLayoutEngine {

    static final String SYNTHETIC_LANE_LABEL = "Unassigned";

    private final FlowGraphBuilder graphBuilder;
    private final FeedbackEdgeDetector feedbackEdgeDetector;
    private final RankAssigner rankAssigner;
    private final LaneAssigner laneAssigner;
    private final CrossingMinimizer crossingMinimizer;
    private final GeometryCalculator geometryCalculator;
    private final EdgeRouter edgeRouter;

    public LayoutModel layout(FlowDocument document) {
        FlowGraph graph = graphBuilder.build(document);

        if (graph.isEmpty()) {
            log.info("[Layout] Flow '{}' has no nodes, returning empty layout", graph.getFlowId());
            return emptyModel(graph);
        }

        FeedbackEdges feedbackEdges = feedbackEdgeDetector.detect(graph);
        Ranking ranking = rankAssigner.assign(graph, feedbackEdges);
        LaneAssignment lanes = laneAssigner.assign(graph, ranking);
        RankOrdering ordering = crossingMinimizer.order(graph, ranking, feedbackEdges);
        DiagramGeometry geometry = geometryCalculator.calculate(graph, ranking, lanes, ordering);
        List<List<LayoutPoint>> routes = edgeRouter.route(graph, ranking, lanes, feedbackEdges, geometry);

        List<LayoutNote> notes = new ArrayList<>();
        notes.addAll(cycleNotes(graph, feedbackEdges));
        notes.addAll(laneNotes(graph, lanes));

        LayoutModel model = LayoutModel.builder()
                .nodes(nodes(graph, ranking, lanes, ordering, geometry))
                .edges(edges(graph, feedbackEdges, routes))
                .lanes(lanes(graph, lanes, geometry))
                .ranks(ranks(geometry))
                .notes(Collections.unmodifiableList(notes))
                .width(geometry.width())
                .height(geometry.height())
                .canvasWidth(geometry.canvasWidth())
                .canvasHeight(geometry.canvasHeight())
                .scaleFactor(geometry.scale())
                .metadata(LayoutMetadata.builder()
                        .flowId(graph.getFlowId())
                        .title(graph.getTitle())
                        .nodeCount(graph.nodeCount())
                        .edgeCount(graph.edgeCount())
                        .laneCount(lanes.laneCount())
                        .rankCount(ranking.rankCount())
                        .feedbackEdgeCount(feedbackEdges.count())
                        .build())
                .build();

        log.info("[Layout] Flow '{}': {} nodes, {} edges, {} lanes, {} ranks, {} feedback edges, {} notes",
                graph.getFlowId(), graph.nodeCount(), graph.edgeCount(), lanes.laneCount(),
                ranking.rankCount(), feedbackEdges.count(), notes.size());
        return model;
    }

    private LayoutModel emptyModel(FlowGraph graph) {
        LayoutNote notice = LayoutNote.builder()
                .type(NoteType.EMPTY_GRAPH_NOTICE)
                .message("Flow has no activities or gateways; nothing to lay out")
                .build();
        return LayoutModel.builder()
                .nodes(List.of())
                .edges(List.of())
                .lanes(List.of())
                .ranks(List.of())
                .notes(List.of(notice))
                .scaleFactor(1.0)
                .metadata(LayoutMetadata.builder()
                        .flowId(graph.getFlowId())
                        .title(graph.getTitle())
                        .build())
                .build();
    }

    private List<LayoutNote> cycleNotes(FlowGraph graph, FeedbackEdges feedbackEdges) {
        List<LayoutNote> notes = new ArrayList<>();
        List<Integer> discovered = feedbackEdges.inDiscoveryOrder();
        for (int i = 0; i < discovered.size(); i++) {
            int edge = discovered.get(i);
            String path = feedbackEdges.cycle(i).stream()
                    .map(graph::nodeId)
                    .collect(Collectors.joining(" -> "));
            notes.add(LayoutNote.builder()
                    .type(NoteType.CYCLE_WARNING)
                    .subjectId(graph.edgeId(edge))
                    .message("Transition '" + graph.edgeId(edge) + "' closes cycle " + path
                            + "; drawn as a loop-back edge")
                    .build());
        }
        return notes;
    }

    private List<LayoutNote> laneNotes(FlowGraph graph, LaneAssignment lanes) {
        List<LayoutNote> notes = new ArrayList<>();
        for (int node : lanes.defaultedNodes()) {
            String message;
            if (graph.isGateway(node)) {
                message = "Gateway '" + graph.nodeId(node) + "' has no neighbour with a lane; placed in lane 0";
            } else if (graph.roleRef(node) == null || graph.roleRef(node).isBlank()) {
                message = "Activity '" + graph.nodeId(node) + "' has no role; placed in the "
                        + SYNTHETIC_LANE_LABEL + " lane";
            } else {
                message = "Activity '" + graph.nodeId(node) + "' references unknown role '" + graph.roleRef(node)
                        + "'; placed in the " + SYNTHETIC_LANE_LABEL + " lane";
            }
            notes.add(LayoutNote.builder()
                    .type(NoteType.LANE_DEFAULT_WARNING)
                    .subjectId(graph.nodeId(node))
                    .message(message)
                    .build());
        }
        return notes;
    }

    private List<LayoutNode> nodes(FlowGraph graph, Ranking ranking, LaneAssignment lanes,
                                   RankOrdering ordering, DiagramGeometry geometry) {
        List<LayoutNode> nodes = new ArrayList<>(graph.nodeCount());
        for (int node = 0; node < graph.nodeCount(); node++) {
            boolean gateway = graph.kind(node) == NodeKind.GATEWAY;
            nodes.add(LayoutNode.builder()
                    .id(graph.nodeId(node))
                    .label(graph.label(node))
                    .kind(graph.kind(node))
                    .gatewayType(gateway ? graph.gatewayType(node) : null)
                    .roleId(gateway ? null : graph.roleRef(node))
                    .laneIndex(lanes.lane(node))
                    .rankIndex(ranking.rank(node))
                    .orderInRank(ordering.orderInRank(node))
                    .x(geometry.x(node))
                    .y(geometry.y(node))
                    .width(geometry.width(node))
                    .height(geometry.height(node))
                    .build());
        }
        return Collections.unmodifiableList(nodes);
    }

    private List<LayoutEdge> edges(FlowGraph graph, FeedbackEdges feedbackEdges, List<List<LayoutPoint>> routes) {
        List<LayoutEdge> edges = new ArrayList<>(graph.edgeCount());
        for (int edge = 0; edge < graph.edgeCount(); edge++) {
            edges.add(LayoutEdge.builder()
                    .id(graph.edgeId(edge))
                    .sourceId(graph.nodeId(graph.source(edge)))
                    .targetId(graph.nodeId(graph.target(edge)))
                    .label(graph.edgeLabel(edge))
                    .waypoints(routes.get(edge))
                    .feedback(feedbackEdges.isFeedback(edge))
                    .build());
        }
        return Collections.unmodifiableList(edges);
    }

    private List<LayoutLane> lanes(FlowGraph graph, LaneAssignment lanes, DiagramGeometry geometry) {
        List<LayoutLane> result = new ArrayList<>(lanes.laneCount());
        for (int lane = 0; lane < lanes.laneCount(); lane++) {
            boolean roleLane = lane < graph.roleCount();
            result.add(LayoutLane.builder()
                    .index(lane)
                    .ownerId(roleLane ? graph.roleId(lane) : null)
                    .label(roleLane ? graph.roleName(lane) : SYNTHETIC_LANE_LABEL)
                    .x(geometry.laneX())
                    .y(geometry.laneY(lane))
                    .width(geometry.laneWidth())
                    .height(geometry.laneHeight(lane))
                    .build());
        }
        return Collections.unmodifiableList(result);
    }

    private List<LayoutRank> ranks(DiagramGeometry geometry) {
        List<LayoutRank> ranks = new ArrayList<>(geometry.rankCount());
        for (int rank = 0; rank < geometry.rankCount(); rank++) {
            ranks.add(LayoutRank.builder()
                    .index(rank)
                    .x(geometry.rankX(rank))
                    .width(geometry.rankWidth(rank))
                    .build());
        }
        return Collections.unmodifiableList(ranks);
    }
}
