package com.architecture.flowlayout.service.layout;

import com.architecture.flowlayout.config.LayoutSettings;
import com.architecture.flowlayout.model.graph.FlowGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns lane, rank and in-rank positions into coordinates.
 *
 * Nodes sit in slots of equal height. Within a lane, the slot of a node is its position
 * among the nodes of the same rank and lane. Each lane is tall enough for its busiest rank,
 * and that block of slots is centred vertically in the lane.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GeometryCalculator {

    private final LayoutSettings settings;
    private final TextWidthEstimator textWidthEstimator;

    public DiagramGeometry calculate(FlowGraph graph, Ranking ranking, LaneAssignment lanes, RankOrdering ordering) {
        int n = graph.nodeCount();
        int laneCount = lanes.laneCount();
        int rankCount = ranking.rankCount();

        double[] width = new double[n];
        double[] height = new double[n];
        for (int node = 0; node < n; node++) {
            if (graph.isGateway(node)) {
                width[node] = settings.getGatewaySize();
                height[node] = settings.getGatewaySize();
            } else {
                width[node] = Math.max(settings.getActivityMinWidth(),
                        textWidthEstimator.estimateWidth(graph.label(node)));
                height[node] = settings.getActivityHeight();
            }
        }
        double slotHeight = Math.max(settings.getActivityHeight(), settings.getGatewaySize());
        double vGap = settings.getVerticalGap();
        double hGap = settings.getHorizontalGap();

        // slot per node and busiest rank per lane
        int[] slot = new int[n];
        int[] busiest = new int[laneCount];
        for (int r = 0; r < rankCount; r++) {
            int[] perLane = new int[laneCount];
            for (int i = 0; i < ordering.size(r); i++) {
                int node = ordering.nodeAt(r, i);
                int lane = lanes.lane(node);
                slot[node] = perLane[lane]++;
                busiest[lane] = Math.max(busiest[lane], perLane[lane]);
            }
        }

        double[] laneY = new double[laneCount];
        double[] laneHeight = new double[laneCount];
        double cursorY = settings.getMarginY();
        for (int lane = 0; lane < laneCount; lane++) {
            laneY[lane] = cursorY;
            laneHeight[lane] = Math.max(settings.getMinLaneHeight(), busiest[lane] * (slotHeight + vGap) + vGap);
            cursorY += laneHeight[lane];
        }

        double[] rankContent = new double[rankCount];
        for (int node = 0; node < n; node++) {
            int r = ranking.rank(node);
            rankContent[r] = Math.max(rankContent[r], width[node]);
        }
        double[] rankX = new double[rankCount];
        double[] rankWidth = new double[rankCount];
        double laneX = settings.getMarginX();
        double cursorX = laneX + settings.getLaneHeaderWidth();
        for (int r = 0; r < rankCount; r++) {
            rankX[r] = cursorX;
            rankWidth[r] = rankContent[r] + hGap;
            cursorX += rankWidth[r];
        }
        double laneWidth = cursorX - laneX;

        double[] x = new double[n];
        double[] y = new double[n];
        for (int node = 0; node < n; node++) {
            int r = ranking.rank(node);
            int lane = lanes.lane(node);
            int k = busiest[lane];
            double blockHeight = k * slotHeight + (k - 1) * vGap;
            double blockTop = laneY[lane] + (laneHeight[lane] - blockHeight) / 2;
            x[node] = rankX[r] + (rankWidth[r] - width[node]) / 2;
            y[node] = blockTop + slot[node] * (slotHeight + vGap) + (slotHeight - height[node]) / 2;
        }

        double canvasWidth = laneWidth + 2 * settings.getMarginX();
        double canvasHeight = cursorY + settings.getMarginY();

        double scale = scaleFactor(n);
        if (scale != 1.0) {
            scaleAll(scale, x, y, width, height, laneY, laneHeight, rankX, rankWidth, rankContent);
            laneX *= scale;
            laneWidth *= scale;
            canvasWidth *= scale;
            canvasHeight *= scale;
        }

        log.debug("[Geometry] {} lanes, {} ranks, scale {}", laneCount, rankCount, scale);
        return new DiagramGeometry(x, y, width, height, laneY, laneHeight, laneX, laneWidth,
                rankX, rankWidth, rankContent, scale, canvasWidth, canvasHeight);
    }

    /**
     * clamp(sqrt(nodeCount / reference), min, max) when scaling is enabled, otherwise 1.
     */
    double scaleFactor(int nodeCount) {
        if (!settings.isScaleEnabled()) {
            return 1.0;
        }
        double raw = Math.sqrt((double) nodeCount / settings.getScaleReferenceNodeCount());
        return Math.min(settings.getMaxScale(), Math.max(settings.getMinScale(), raw));
    }

    private static void scaleAll(double scale, double[]... arrays) {
        for (double[] values : arrays) {
            for (int i = 0; i < values.length; i++) {
                values[i] *= scale;
            }
        }
    }
}
