package com.architecture.flowlayout.service.layout;

import java.util.List;

/**
 * Lane index per node. Role lanes occupy [0, roleCount); the synthetic lane, when present,
 * is the last index.
 */
public final class LaneAssignment {

    private final int[] lane;
    private final int laneCount;
    private final boolean syntheticLane;
    private final List<Integer> defaultedNodes;

    LaneAssignment(int[] lane, int laneCount, boolean syntheticLane, List<Integer> defaultedNodes) {
        this.lane = lane;
        this.laneCount = laneCount;
        this.syntheticLane = syntheticLane;
        this.defaultedNodes = List.copyOf(defaultedNodes);
    }

    public int lane(int node) {
        return lane[node];
    }

    public int laneCount() {
        return laneCount;
    }

    public boolean hasSyntheticLane() {
        return syntheticLane;
    }

    /** Nodes whose lane came from a fallback default, in node index order. */
    public List<Integer> defaultedNodes() {
        return defaultedNodes;
    }
}
