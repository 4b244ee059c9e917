package com.architecture.flowlayout.config;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable layout constants shared by the geometry and routing stages.
 * All lengths are in abstract layout units before the global scale factor is applied.
 */
@Value
@Builder(toBuilder = true)
public class LayoutSettings {

    double activityMinWidth;
    double activityHeight;
    double gatewaySize;

    double charWidth;       // width of one single-width text unit
    double labelPadding;    // horizontal padding on each side of an activity label

    double horizontalGap;
    double verticalGap;

    double minLaneHeight;
    double laneHeaderWidth;

    double marginX;
    double marginY;

    int maxSweeps;

    boolean scaleEnabled;
    int scaleReferenceNodeCount;
    double minScale;
    double maxScale;

    public static LayoutSettings defaults() {
        return LayoutSettings.builder()
                .activityMinWidth(120)
                .activityHeight(80)
                .gatewaySize(60)
                .charWidth(8)
                .labelPadding(16)
                .horizontalGap(80)
                .verticalGap(20)
                .minLaneHeight(150)
                .laneHeaderWidth(180)
                .marginX(50)
                .marginY(50)
                .maxSweeps(4)
                .scaleEnabled(true)
                .scaleReferenceNodeCount(10)
                .minScale(1.0)
                .maxScale(2.0)
                .build();
    }

    /**
     * Reject settings that would break the layout invariants.
     * The top margin must be positive because feedback edges are routed through it.
     */
    public LayoutSettings validate() {
        requirePositive(activityMinWidth, "activityMinWidth");
        requirePositive(activityHeight, "activityHeight");
        requirePositive(gatewaySize, "gatewaySize");
        requirePositive(charWidth, "charWidth");
        requirePositive(horizontalGap, "horizontalGap");
        requirePositive(marginY, "marginY");
        requireNonNegative(labelPadding, "labelPadding");
        requireNonNegative(verticalGap, "verticalGap");
        requireNonNegative(minLaneHeight, "minLaneHeight");
        requireNonNegative(laneHeaderWidth, "laneHeaderWidth");
        requireNonNegative(marginX, "marginX");
        if (maxSweeps < 0) {
            throw new IllegalArgumentException("layout maxSweeps must be >= 0 but was " + maxSweeps);
        }
        if (scaleEnabled) {
            if (scaleReferenceNodeCount <= 0) {
                throw new IllegalArgumentException("layout scaleReferenceNodeCount must be > 0 but was "
                        + scaleReferenceNodeCount);
            }
            requirePositive(minScale, "minScale");
            if (maxScale < minScale) {
                throw new IllegalArgumentException("layout maxScale (" + maxScale
                        + ") must not be smaller than minScale (" + minScale + ")");
            }
        }
        return this;
    }

    private static void requirePositive(double value, String name) {
        if (!(value > 0)) {
            throw new IllegalArgumentException("layout " + name + " must be > 0 but was " + value);
        }
    }

    private static void requireNonNegative(double value, String name) {
        if (!(value >= 0)) {
            throw new IllegalArgumentException("layout " + name + " must be >= 0 but was " + value);
        }
    }
}
