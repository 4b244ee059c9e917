package com.architecture.flowlayout.service.layout;

import com.architecture.flowlayout.dto.layout.LayoutPoint;
import com.architecture.flowlayout.model.graph.FlowGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes orthogonal waypoints for every transition.
 *
 * Forward edges leave the source on its right side and enter the target on its left side.
 * Neighbours in the same lane at the same height get a single straight segment; everything
 * else turns twice inside a vertical channel placed in the free gap between two ranks.
 *
 * Feedback edges leave the source and enter the target on their left sides. Each vertical
 * leg runs in the node-free channel just left of its node's rank, and the legs meet in the
 * margin above the topmost node. Nodes of one rank never share a vertical range, so the
 * short horizontal legs at the anchors stay clear of other nodes.
 *
 * Known limit: a forward edge keeps its two turns even when both the gap after the source
 * rank and the gap before the target rank leave a horizontal leg crossing an intermediate
 * node, for example a skip edge along a lane whose ranks in between are occupied. The
 * route then takes the gap after the source rank.
 */
@Service
@Slf4j
public class EdgeRouter {

    private static final double EPSILON = 1e-6;
    private static final int FIRST = 0;
    private static final int SECOND = 1;

    /**
     * Waypoints indexed by edge index.
     */
    public List<List<LayoutPoint>> route(FlowGraph graph, Ranking ranking, LaneAssignment lanes,
                                         FeedbackEdges feedbackEdges, DiagramGeometry geometry) {
        int m = graph.edgeCount();
        List<List<LayoutPoint>> routes = new ArrayList<>(m);
        for (int edge = 0; edge < m; edge++) {
            routes.add(null);
        }

        // channel requests keyed by the rank they sit left of; forward edges first, then feedback legs
        int rankCount = ranking.rankCount();
        List<List<Integer>> legsByChannel = new ArrayList<>(rankCount);
        for (int r = 0; r < rankCount; r++) {
            legsByChannel.add(new ArrayList<>());
        }
        List<Integer> feedback = new ArrayList<>();

        for (int edge = 0; edge < m; edge++) {
            int source = graph.source(edge);
            int target = graph.target(edge);
            if (feedbackEdges.isFeedback(edge)) {
                feedback.add(edge);
            } else if (isStraight(ranking, lanes, geometry, source, target)) {
                routes.set(edge, List.of(
                        LayoutPoint.of(geometry.x(source) + geometry.width(source), geometry.centerY(source)),
                        LayoutPoint.of(geometry.x(target), geometry.centerY(target))));
            } else {
                int gap = chooseGap(ranking, geometry, source, target);
                legsByChannel.get(gap + 1).add(leg(edge, FIRST));
            }
        }
        for (int edge : feedback) {
            // target leg first so a self-loop's two legs do not cross
            legsByChannel.get(ranking.rank(graph.target(edge))).add(leg(edge, SECOND));
            legsByChannel.get(ranking.rank(graph.source(edge))).add(leg(edge, FIRST));
        }

        double[] firstChannel = new double[m];
        double[] secondChannel = new double[m];
        for (int r = 0; r < rankCount; r++) {
            List<Integer> shared = legsByChannel.get(r);
            if (shared.isEmpty()) continue;
            double start = geometry.channelStart(r);
            double channelWidth = geometry.channelEnd(r) - start;
            for (int k = 0; k < shared.size(); k++) {
                int leg = shared.get(k);
                double channelX = start + channelWidth * (k + 1) / (shared.size() + 1);
                if (leg % 2 == FIRST) {
                    firstChannel[leg / 2] = channelX;
                } else {
                    secondChannel[leg / 2] = channelX;
                }
            }
        }

        for (int edge = 0; edge < m; edge++) {
            if (routes.get(edge) == null && !feedbackEdges.isFeedback(edge)) {
                routes.set(edge, manhattan(geometry, graph.source(edge), graph.target(edge), firstChannel[edge]));
            }
        }

        double top = geometry.minNodeTop();
        for (int k = 0; k < feedback.size(); k++) {
            int edge = feedback.get(k);
            double channelY = top * (k + 1) / (feedback.size() + 1);
            routes.set(edge, loopBack(geometry, graph.source(edge), graph.target(edge),
                    firstChannel[edge], secondChannel[edge], channelY));
        }

        log.debug("[Routing] Routed {} edges ({} feedback)", m, feedback.size());
        return routes;
    }

    private static int leg(int edge, int which) {
        return edge * 2 + which;
    }

    private boolean isStraight(Ranking ranking, LaneAssignment lanes, DiagramGeometry geometry, int source, int target) {
        return lanes.lane(source) == lanes.lane(target)
                && ranking.rank(target) == ranking.rank(source) + 1
                && Math.abs(geometry.centerY(source) - geometry.centerY(target)) < EPSILON;
    }

    /**
     * The gap right after the source rank, unless entering the target from there would cut
     * through another node while the gap just before the target rank stays clear.
     */
    private int chooseGap(Ranking ranking, DiagramGeometry geometry, int source, int target) {
        int sourceGap = ranking.rank(source);
        int targetGap = ranking.rank(target) - 1;
        if (sourceGap == targetGap) {
            return sourceGap;
        }
        boolean finalLegBlocked = crossesNode(geometry, geometry.centerY(target),
                geometry.gapEnd(sourceGap), geometry.x(target), source, target);
        if (!finalLegBlocked) {
            return sourceGap;
        }
        boolean firstLegBlocked = crossesNode(geometry, geometry.centerY(source),
                geometry.x(source) + geometry.width(source), geometry.gapStart(targetGap), source, target);
        return firstLegBlocked ? sourceGap : targetGap;
    }

    /**
     * Whether the horizontal segment at lineY between fromX and toX passes through the
     * interior of any node other than the edge's endpoints.
     */
    private boolean crossesNode(DiagramGeometry geometry, double lineY, double fromX, double toX, int source, int target) {
        double left = Math.min(fromX, toX);
        double right = Math.max(fromX, toX);
        int n = geometry.nodeCount();
        for (int node = 0; node < n; node++) {
            if (node == source || node == target) continue;
            double x = geometry.x(node);
            double y = geometry.y(node);
            if (x < right && x + geometry.width(node) > left
                    && y < lineY && lineY < y + geometry.height(node)) {
                return true;
            }
        }
        return false;
    }

    private List<LayoutPoint> manhattan(DiagramGeometry geometry, int source, int target, double channelX) {
        double sourceY = geometry.centerY(source);
        double targetY = geometry.centerY(target);
        return List.of(
                LayoutPoint.of(geometry.x(source) + geometry.width(source), sourceY),
                LayoutPoint.of(channelX, sourceY),
                LayoutPoint.of(channelX, targetY),
                LayoutPoint.of(geometry.x(target), targetY));
    }

    /**
     * Out of the source's left side, up its channel to channelY, across, then down the
     * target's channel into the target's left side. A self-loop uses the upper and lower
     * quarter points of the left side.
     */
    private List<LayoutPoint> loopBack(DiagramGeometry geometry, int source, int target,
                                       double sourceChannelX, double targetChannelX, double channelY) {
        double sourceY = geometry.centerY(source);
        double targetY = geometry.centerY(target);
        if (source == target) {
            double offset = geometry.height(source) / 4;
            sourceY -= offset;
            targetY += offset;
        }
        return List.of(
                LayoutPoint.of(geometry.x(source), sourceY),
                LayoutPoint.of(sourceChannelX, sourceY),
                LayoutPoint.of(sourceChannelX, channelY),
                LayoutPoint.of(targetChannelX, channelY),
                LayoutPoint.of(targetChannelX, targetY),
                LayoutPoint.of(geometry.x(target), targetY));
    }
}
