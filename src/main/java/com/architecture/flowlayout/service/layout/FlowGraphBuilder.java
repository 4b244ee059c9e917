package com.architecture.flowlayout.service.layout;

import com.architecture.flowlayout.dto.flow.FlowActivity;
import com.architecture.flowlayout.dto.flow.FlowDocument;
import com.architecture.flowlayout.dto.flow.FlowGateway;
import com.architecture.flowlayout.dto.flow.FlowMetadata;
import com.architecture.flowlayout.dto.flow.FlowRole;
import com.architecture.flowlayout.dto.flow.FlowTransition;
import com.architecture.flowlayout.exception.FlowReferenceException;
import com.architecture.flowlayout.model.graph.FlowGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;

/**
 * Assembles the index-addressed {@link FlowGraph} from a flow document.
 *
 * Node order is fixed: activities in document order, then gateways in document order.
 * Transitions keep document order. The only check performed is referential integrity
 * of transition endpoints.
 */
@Service
@Slf4j
public class FlowGraphBuilder {

    public FlowGraph build(FlowDocument document) {
        FlowGraph.Builder builder = FlowGraph.builder();

        FlowMetadata metadata = document.getMetadata();
        if (metadata != null) {
            builder.flow(metadata.getId(), metadata.getTitle());
        }

        for (FlowRole role : nullSafe(document.getRoles())) {
            builder.addRole(role.getId(), role.getName() != null ? role.getName() : role.getId());
        }
        for (FlowActivity activity : nullSafe(document.getActivities())) {
            builder.addActivity(activity.getId(), labelOf(activity.getName(), activity.getId()), activity.getRoleId());
        }
        for (FlowGateway gateway : nullSafe(document.getGateways())) {
            // Gateway labels are drawn outside the diamond; an unnamed gateway stays unlabeled
            builder.addGateway(gateway.getId(), gateway.getName(), gateway.getType());
        }

        for (FlowTransition transition : nullSafe(document.getTransitions())) {
            if (!builder.hasNode(transition.getSource())) {
                throw new FlowReferenceException(transition.getId(), transition.getSource());
            }
            if (!builder.hasNode(transition.getTarget())) {
                throw new FlowReferenceException(transition.getId(), transition.getTarget());
            }
            String label = transition.getCondition() != null ? transition.getCondition() : transition.getName();
            builder.addEdge(transition.getId(), transition.getSource(), transition.getTarget(), label);
        }

        FlowGraph graph = builder.build();
        log.debug("[GraphModel] Built graph with {} nodes, {} edges, {} roles",
                graph.nodeCount(), graph.edgeCount(), graph.roleCount());
        return graph;
    }

    private static String labelOf(String name, String fallback) {
        return name != null && !name.isBlank() ? name : fallback;
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : Collections.emptyList();
    }
}
