package com.architecture.flowlayout.service.layout;

import com.architecture.flowlayout.config.LayoutSettings;
import com.architecture.flowlayout.model.graph.FlowGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Barycenter heuristic for reducing edge crossings between adjacent ranks.
 *
 * Starts from the topological order, then runs a bounded number of alternating sweeps
 * (downstream first). Feedback edges and edges spanning more than one rank are ignored.
 * The loop ends early once a sweep leaves every rank unchanged.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CrossingMinimizer {

    private final LayoutSettings settings;

    public RankOrdering order(FlowGraph graph, Ranking ranking, FeedbackEdges feedbackEdges) {
        int n = graph.nodeCount();
        int rankCount = ranking.rankCount();

        int[] rankSize = new int[rankCount];
        for (int node = 0; node < n; node++) {
            rankSize[ranking.rank(node)]++;
        }
        int[][] nodesByRank = new int[rankCount][];
        for (int r = 0; r < rankCount; r++) {
            nodesByRank[r] = new int[rankSize[r]];
        }
        int[] fill = new int[rankCount];
        int[] position = new int[n];
        for (int pos = 0; pos < n; pos++) {
            int node = ranking.nodeAt(pos);
            int r = ranking.rank(node);
            position[node] = fill[r];
            nodesByRank[r][fill[r]++] = node;
        }

        SweepDirection direction = SweepDirection.DOWNSTREAM;
        int sweeps = 0;
        while (sweeps < settings.getMaxSweeps()) {
            boolean changed = sweep(graph, ranking, feedbackEdges, nodesByRank, position, direction);
            sweeps++;
            if (!changed) {
                break;
            }
            direction = direction.opposite();
        }

        log.debug("[Ordering] {} sweep(s) over {} ranks", sweeps, rankCount);
        return new RankOrdering(nodesByRank, n);
    }

    private boolean sweep(FlowGraph graph, Ranking ranking, FeedbackEdges feedbackEdges,
                          int[][] nodesByRank, int[] position, SweepDirection direction) {
        boolean changed = false;
        int rankCount = nodesByRank.length;
        if (direction == SweepDirection.DOWNSTREAM) {
            for (int r = rankCount - 2; r >= 0; r--) {
                changed |= reorder(graph, ranking, feedbackEdges, nodesByRank[r], position, r + 1, true);
            }
        } else {
            for (int r = 1; r < rankCount; r++) {
                changed |= reorder(graph, ranking, feedbackEdges, nodesByRank[r], position, r - 1, false);
            }
        }
        return changed;
    }

    /**
     * Stable sort of one rank by the mean position of its neighbours in the reference rank.
     * Nodes without such neighbours keep their own position as the sort key.
     */
    private boolean reorder(FlowGraph graph, Ranking ranking, FeedbackEdges feedbackEdges,
                            int[] rank, int[] position, int referenceRank, boolean successors) {
        double[] barycenter = new double[graph.nodeCount()];
        List<Integer> nodes = new ArrayList<>(rank.length);
        for (int node : rank) {
            barycenter[node] = barycenter(graph, ranking, feedbackEdges, position, node, referenceRank, successors);
            nodes.add(node);
        }
        nodes.sort(Comparator.comparingDouble(node -> barycenter[node]));

        int[] before = Arrays.copyOf(rank, rank.length);
        for (int i = 0; i < rank.length; i++) {
            rank[i] = nodes.get(i);
            position[rank[i]] = i;
        }
        return !Arrays.equals(before, rank);
    }

    private double barycenter(FlowGraph graph, Ranking ranking, FeedbackEdges feedbackEdges,
                              int[] position, int node, int referenceRank, boolean successors) {
        int degree = successors ? graph.outDegree(node) : graph.inDegree(node);
        double sum = 0;
        int count = 0;
        for (int k = 0; k < degree; k++) {
            int edge = successors ? graph.outEdge(node, k) : graph.inEdge(node, k);
            if (feedbackEdges.isFeedback(edge)) continue;
            int neighbour = successors ? graph.target(edge) : graph.source(edge);
            if (ranking.rank(neighbour) != referenceRank) continue;
            sum += position[neighbour];
            count++;
        }
        return count == 0 ? position[node] : sum / count;
    }
}
