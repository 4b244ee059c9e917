package com.architecture.flowlayout.service.layout;

/**
 * Top-to-bottom order of nodes inside each rank after crossing reduction.
 */
public final class RankOrdering {

    private final int[][] nodesByRank;
    private final int[] orderInRank;

    RankOrdering(int[][] nodesByRank, int nodeCount) {
        this.nodesByRank = nodesByRank;
        this.orderInRank = new int[nodeCount];
        for (int[] rank : nodesByRank) {
            for (int i = 0; i < rank.length; i++) {
                orderInRank[rank[i]] = i;
            }
        }
    }

    public int rankCount() {
        return nodesByRank.length;
    }

    public int size(int rank) {
        return nodesByRank[rank].length;
    }

    public int nodeAt(int rank, int position) {
        return nodesByRank[rank][position];
    }

    public int orderInRank(int node) {
        return orderInRank[node];
    }
}
