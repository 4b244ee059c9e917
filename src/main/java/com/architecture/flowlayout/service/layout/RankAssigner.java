package com.architecture.flowlayout.service.layout;

import com.architecture.flowlayout.model.graph.FlowGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Longest-path layering over the acyclic subgraph left after removing feedback edges.
 *
 * Kahn's algorithm with a FIFO queue seeded by in-degree-zero nodes in index order.
 * A node is dequeued only after all of its predecessors, so its rank
 * (1 + max predecessor rank, or 0 for sources) is final at that point.
 */
@Service
@Slf4j
public class RankAssigner {

    public Ranking assign(FlowGraph graph, FeedbackEdges feedbackEdges) {
        int n = graph.nodeCount();
        int[] rank = new int[n];
        int[] remainingIn = new int[n];
        int[] queue = new int[n];
        int head = 0;
        int tail = 0;

        for (int node = 0; node < n; node++) {
            for (int k = 0; k < graph.inDegree(node); k++) {
                if (!feedbackEdges.isFeedback(graph.inEdge(node, k))) {
                    remainingIn[node]++;
                }
            }
        }
        for (int node = 0; node < n; node++) {
            if (remainingIn[node] == 0) {
                queue[tail++] = node;
            }
        }

        int maxRank = -1;
        while (head < tail) {
            int node = queue[head++];
            maxRank = Math.max(maxRank, rank[node]);
            for (int k = 0; k < graph.outDegree(node); k++) {
                int edge = graph.outEdge(node, k);
                if (feedbackEdges.isFeedback(edge)) continue;
                int next = graph.target(edge);
                rank[next] = Math.max(rank[next], rank[node] + 1);
                if (--remainingIn[next] == 0) {
                    queue[tail++] = next;
                }
            }
        }

        if (tail != n) {
            throw new IllegalStateException("Layering left " + (n - tail) + " nodes unranked; feedback set is not a cycle cover");
        }

        log.debug("[Layering] Assigned {} nodes to {} ranks", n, maxRank + 1);
        return new Ranking(rank, queue, maxRank + 1);
    }
}
