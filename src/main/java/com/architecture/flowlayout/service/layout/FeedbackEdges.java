package com.architecture.flowlayout.service.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only set of transitions excluded from layering.
 * Feedback edges keep the order in which the DFS discovered them, together with
 * the node cycle each one closes.
 */
public final class FeedbackEdges {

    private final boolean[] flags;
    private final List<Integer> discoveryOrder;
    private final List<List<Integer>> cycles;

    FeedbackEdges(boolean[] flags, List<Integer> discoveryOrder, List<List<Integer>> cycles) {
        this.flags = flags;
        this.discoveryOrder = List.copyOf(discoveryOrder);
        this.cycles = List.copyOf(cycles);
    }

    static FeedbackEdges none(int edgeCount) {
        return new FeedbackEdges(new boolean[edgeCount], new ArrayList<>(), new ArrayList<>());
    }

    public boolean isFeedback(int edge) {
        return flags[edge];
    }

    public int count() {
        return discoveryOrder.size();
    }

    /** Feedback edge indices in discovery order. */
    public List<Integer> inDiscoveryOrder() {
        return discoveryOrder;
    }

    /**
     * Node indices of the cycle closed by the i-th discovered feedback edge,
     * starting and ending at the edge's target, e.g. [a1, a2, a3, a1].
     */
    public List<Integer> cycle(int i) {
        return cycles.get(i);
    }
}
