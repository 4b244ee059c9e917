package com.architecture.flowlayout.service.layout;

import com.architecture.flowlayout.config.LayoutSettings;
import com.architecture.flowlayout.dto.flow.GatewayType;
import com.architecture.flowlayout.model.graph.FlowGraph;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeometryCalculatorTest {

    private static final LayoutSettings SETTINGS = LayoutSettings.defaults();

    private final GeometryCalculator calculator =
            new GeometryCalculator(SETTINGS, new TextWidthEstimator(SETTINGS));

    private DiagramGeometry calculate(FlowGraph graph, GeometryCalculator calculator) {
        FeedbackEdges feedback = new FeedbackEdgeDetector().detect(graph);
        Ranking ranking = new RankAssigner().assign(graph, feedback);
        LaneAssignment lanes = new LaneAssigner().assign(graph, ranking);
        RankOrdering ordering = new CrossingMinimizer(SETTINGS).order(graph, ranking, feedback);
        return calculator.calculate(graph, ranking, lanes, ordering);
    }

    @Test
    void sizesNodesFromLabelsAndKind() {
        FlowGraph graph = FlowGraph.builder()
                .addRole("clerk", "Clerk")
                .addActivity("short", "File", "clerk")
                .addActivity("long", "Reconcile the ledger", "clerk")
                .addGateway("g", "OK?", GatewayType.EXCLUSIVE)
                .addEdge("t1", "short", "g", null)
                .addEdge("t2", "g", "long", null)
                .build();

        DiagramGeometry geometry = calculate(graph, calculator);

        assertThat(geometry.width(0)).isEqualTo(120);
        assertThat(geometry.width(1)).isEqualTo(20 * 8 + 32);
        assertThat(geometry.height(1)).isEqualTo(80);
        assertThat(geometry.width(2)).isEqualTo(60);
        assertThat(geometry.height(2)).isEqualTo(60);
    }

    @Test
    void placesSequenceLeftToRightAtSameHeight() {
        FlowGraph graph = FlowGraph.builder()
                .addRole("clerk", "Clerk")
                .addActivity("a", "File", "clerk")
                .addGateway("g", "OK?", GatewayType.EXCLUSIVE)
                .addActivity("b", "Pay", "clerk")
                .addEdge("t1", "a", "g", null)
                .addEdge("t2", "g", "b", null)
                .build();

        DiagramGeometry geometry = calculate(graph, calculator);

        // rank 0 starts after the left margin and the lane header
        assertThat(geometry.rankX(0)).isEqualTo(50 + 180);
        assertThat(geometry.rankWidth(0)).isEqualTo(120 + 80);
        assertThat(geometry.x(0)).isEqualTo(230 + 40);
        assertThat(geometry.rankWidth(1)).isEqualTo(60 + 80);
        assertThat(geometry.x(1)).isEqualTo(430 + 40);
        assertThat(geometry.centerY(1)).isEqualTo(geometry.centerY(0));
        assertThat(geometry.centerY(2)).isEqualTo(geometry.centerY(0));
        assertThat(geometry.y(0)).isEqualTo(50 + (150 - 80) / 2.0);
    }

    @Test
    void stacksNodesOfSameRankAndLane_andGrowsTheLane() {
        FlowGraph graph = FlowGraph.builder()
                .addRole("clerk", "Clerk")
                .addRole("manager", "Manager")
                .addActivity("a", "File", "clerk")
                .addActivity("b", "Print", "clerk")
                .addActivity("c", "Sign", "manager")
                .build();

        DiagramGeometry geometry = calculate(graph, calculator);

        assertThat(geometry.laneHeight(0)).isEqualTo(2 * (80 + 20) + 20);
        assertThat(geometry.laneY(1)).isEqualTo(50 + 220);
        assertThat(geometry.laneHeight(1)).isEqualTo(150);
        assertThat(geometry.y(0)).isEqualTo(70);
        assertThat(geometry.y(1)).isEqualTo(170);
        assertThat(geometry.y(0) + geometry.height(0)).isLessThanOrEqualTo(geometry.y(1));
        assertThat(geometry.canvasHeight()).isEqualTo(50 + 220 + 150 + 50);
    }

    @Test
    void reportsNodeBoundsAndCanvas() {
        FlowGraph graph = FlowGraph.builder()
                .addRole("clerk", "Clerk")
                .addActivity("a", "File", "clerk")
                .addActivity("b", "Pay", "clerk")
                .addEdge("t1", "a", "b", null)
                .build();

        DiagramGeometry geometry = calculate(graph, calculator);

        assertThat(geometry.width()).isEqualTo(geometry.x(1) + 120);
        assertThat(geometry.height()).isEqualTo(geometry.y(0) + 80);
        assertThat(geometry.laneWidth()).isEqualTo(180 + 2 * 200);
        assertThat(geometry.canvasWidth()).isEqualTo(50 + 180 + 400 + 50);
        assertThat(geometry.gapStart(0)).isEqualTo(geometry.x(0) + 120);
        assertThat(geometry.gapEnd(0)).isEqualTo(geometry.x(1));
    }

    @Test
    void computesScaleFactorFromNodeCount() {
        assertThat(calculator.scaleFactor(3)).isEqualTo(1.0);
        assertThat(calculator.scaleFactor(25)).isCloseTo(Math.sqrt(2.5), within(1e-12));
        assertThat(calculator.scaleFactor(400)).isEqualTo(2.0);

        LayoutSettings fixed = SETTINGS.toBuilder().scaleEnabled(false).build();
        assertThat(new GeometryCalculator(fixed, new TextWidthEstimator(fixed)).scaleFactor(400)).isEqualTo(1.0);
    }

    @Test
    void appliesScaleToEveryCoordinate() {
        LayoutSettings settings = SETTINGS.toBuilder().scaleReferenceNodeCount(1).maxScale(1.25).build();
        GeometryCalculator scaled = new GeometryCalculator(settings, new TextWidthEstimator(settings));
        FlowGraph graph = FlowGraph.builder()
                .addRole("clerk", "Clerk")
                .addActivity("a", "File", "clerk")
                .addActivity("b", "Pay", "clerk")
                .addEdge("t1", "a", "b", null)
                .build();

        DiagramGeometry plain = calculate(graph, calculator);
        DiagramGeometry geometry = calculate(graph, scaled);

        assertThat(geometry.scale()).isEqualTo(1.25);
        assertThat(geometry.x(1)).isEqualTo(plain.x(1) * 1.25);
        assertThat(geometry.y(1)).isEqualTo(plain.y(1) * 1.25);
        assertThat(geometry.width(1)).isEqualTo(150);
        assertThat(geometry.laneHeight(0)).isEqualTo(187.5);
        assertThat(geometry.canvasWidth()).isEqualTo(plain.canvasWidth() * 1.25);
    }
}
