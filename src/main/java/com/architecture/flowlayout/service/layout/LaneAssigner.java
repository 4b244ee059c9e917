package com.architecture.flowlayout.service.layout;

import com.architecture.flowlayout.model.graph.FlowGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps every node to a swimlane.
 *
 * Activities take the lane of their role. Gateways have no role and inherit a lane:
 * 1. forward pass in topological order: lane of the first predecessor (by topological
 *    position) whose lane is already known
 * 2. backward pass for the rest: lane of the first successor whose lane is known
 * 3. otherwise lane 0, recorded as a lane default
 *
 * Activities without a resolvable role, and every node of a document without roles,
 * go to a synthetic lane appended after the role lanes.
 */
@Service
@Slf4j
public class LaneAssigner {

    private static final int UNASSIGNED = -1;

    public LaneAssignment assign(FlowGraph graph, Ranking ranking) {
        int n = graph.nodeCount();
        int roleCount = graph.roleCount();
        int syntheticLane = roleCount;
        boolean syntheticUsed = false;

        int[] lane = new int[n];
        boolean[] defaulted = new boolean[n];

        for (int node = 0; node < n; node++) {
            if (graph.isGateway(node)) {
                lane[node] = UNASSIGNED;
            } else if (graph.roleIndex(node) >= 0) {
                lane[node] = graph.roleIndex(node);
            } else {
                lane[node] = syntheticLane;
                defaulted[node] = true;
                syntheticUsed = true;
                log.debug("[Lanes] Activity {} has unresolved role '{}', using synthetic lane",
                        graph.nodeId(node), graph.roleRef(node));
            }
        }

        for (int pos = 0; pos < n; pos++) {
            int node = ranking.nodeAt(pos);
            if (lane[node] == UNASSIGNED) {
                lane[node] = firstKnownPredecessorLane(graph, ranking, lane, node);
            }
        }
        for (int pos = n - 1; pos >= 0; pos--) {
            int node = ranking.nodeAt(pos);
            if (lane[node] == UNASSIGNED) {
                lane[node] = firstKnownSuccessorLane(graph, ranking, lane, node);
            }
        }
        for (int node = 0; node < n; node++) {
            if (lane[node] == UNASSIGNED) {
                lane[node] = 0;
                defaulted[node] = true;
                if (roleCount == 0) {
                    syntheticUsed = true;
                }
                log.debug("[Lanes] Gateway {} has no placed neighbour, defaulting to lane 0", graph.nodeId(node));
            }
        }

        List<Integer> defaultedNodes = new ArrayList<>();
        for (int node = 0; node < n; node++) {
            if (defaulted[node]) {
                defaultedNodes.add(node);
            }
        }

        int laneCount = n == 0 ? 0 : roleCount + (syntheticUsed ? 1 : 0);
        return new LaneAssignment(lane, laneCount, syntheticUsed, defaultedNodes);
    }

    private int firstKnownPredecessorLane(FlowGraph graph, Ranking ranking, int[] lane, int node) {
        int best = UNASSIGNED;
        int bestPosition = Integer.MAX_VALUE;
        for (int k = 0; k < graph.inDegree(node); k++) {
            int pred = graph.source(graph.inEdge(node, k));
            int position = ranking.topologicalPosition(pred);
            if (lane[pred] != UNASSIGNED && position < bestPosition) {
                best = lane[pred];
                bestPosition = position;
            }
        }
        return best;
    }

    private int firstKnownSuccessorLane(FlowGraph graph, Ranking ranking, int[] lane, int node) {
        int best = UNASSIGNED;
        int bestPosition = Integer.MAX_VALUE;
        for (int k = 0; k < graph.outDegree(node); k++) {
            int succ = graph.target(graph.outEdge(node, k));
            int position = ranking.topologicalPosition(succ);
            if (lane[succ] != UNASSIGNED && position < bestPosition) {
                best = lane[succ];
                bestPosition = position;
            }
        }
        return best;
    }
}
