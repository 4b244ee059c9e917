package com.architecture.flowlayout.service.layout;

/**
 * Output of layering: a column index per node plus the topological order used to compute it.
 */
public final class Ranking {

    private final int[] rank;
    private final int[] topologicalOrder;
    private final int[] topologicalPosition;
    private final int rankCount;

    Ranking(int[] rank, int[] topologicalOrder, int rankCount) {
        this.rank = rank;
        this.topologicalOrder = topologicalOrder;
        this.rankCount = rankCount;
        this.topologicalPosition = new int[topologicalOrder.length];
        for (int pos = 0; pos < topologicalOrder.length; pos++) {
            topologicalPosition[topologicalOrder[pos]] = pos;
        }
    }

    public int rank(int node) {
        return rank[node];
    }

    public int rankCount() {
        return rankCount;
    }

    public int nodeCount() {
        return topologicalOrder.length;
    }

    /** The node visited at the given step of the topological traversal. */
    public int nodeAt(int position) {
        return topologicalOrder[position];
    }

    public int topologicalPosition(int node) {
        return topologicalPosition[node];
    }
}
