package com.architecture.flowlayout.service.layout;

import com.architecture.flowlayout.config.LayoutSettings;
import com.architecture.flowlayout.dto.flow.FlowActivity;
import com.architecture.flowlayout.dto.flow.FlowGateway;
import com.architecture.flowlayout.dto.flow.FlowRole;
import com.architecture.flowlayout.dto.flow.FlowTransition;
import com.architecture.flowlayout.dto.flow.GatewayType;

/**
 * Builders shared by the layout tests.
 */
final class LayoutFixtures {

    private LayoutFixtures() {
    }

    static FlowLayoutEngine engine() {
        return engine(LayoutSettings.defaults());
    }

    static FlowLayoutEngine engine(LayoutSettings settings) {
        return new FlowLayoutEngine(
                new FlowGraphBuilder(),
                new FeedbackEdgeDetector(),
                new RankAssigner(),
                new LaneAssigner(),
                new CrossingMinimizer(settings),
                new GeometryCalculator(settings, new TextWidthEstimator(settings)),
                new EdgeRouter());
    }

    static FlowRole role(String id) {
        return FlowRole.builder().id(id).name(id.toUpperCase()).type("human").build();
    }

    static FlowActivity activity(String id, String roleId) {
        return FlowActivity.builder().id(id).name("Step " + id).roleId(roleId).build();
    }

    static FlowGateway gateway(String id) {
        return FlowGateway.builder().id(id).name("Decide " + id).type(GatewayType.EXCLUSIVE).build();
    }

    static FlowTransition transition(String id, String source, String target) {
        return FlowTransition.builder().id(id).source(source).target(target).build();
    }
}
