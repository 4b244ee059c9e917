package com.architecture.flowlayout.service.layout;

import com.architecture.flowlayout.model.graph.FlowGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects cycle-closing transitions using DFS back-edge detection.
 *
 * The pass is read-only: it computes the exclusion set and never touches the graph.
 * The DFS uses an explicit stack so deep process chains cannot overflow the call stack.
 *
 * Root order: nodes without incoming transitions first (index order), then any node
 * still unvisited (index order), so loops are cut at the edge pointing back toward
 * the start of the flow.
 */
@Service
@Slf4j
public class FeedbackEdgeDetector {

    private static final int UNVISITED = 0;
    private static final int ON_STACK = 1;
    private static final int DONE = 2;

    public FeedbackEdges detect(FlowGraph graph) {
        int n = graph.nodeCount();
        int m = graph.edgeCount();
        if (m == 0) {
            return FeedbackEdges.none(m);
        }

        boolean[] feedback = new boolean[m];
        List<Integer> discovered = new ArrayList<>();
        List<List<Integer>> cycles = new ArrayList<>();

        int[] state = new int[n];
        int[] stackNode = new int[n];
        int[] stackCursor = new int[n];
        int[] stackPosition = new int[n];   // where a node sits on the DFS stack while ON_STACK

        for (int pass = 0; pass < 2; pass++) {
            for (int root = 0; root < n; root++) {
                if (state[root] != UNVISITED) continue;
                if (pass == 0 && graph.inDegree(root) > 0) continue;

                int top = 0;
                stackNode[0] = root;
                stackCursor[0] = 0;
                stackPosition[root] = 0;
                state[root] = ON_STACK;

                while (top >= 0) {
                    int node = stackNode[top];
                    if (stackCursor[top] == graph.outDegree(node)) {
                        state[node] = DONE;
                        top--;
                        continue;
                    }
                    int edge = graph.outEdge(node, stackCursor[top]++);
                    int next = graph.target(edge);

                    if (state[next] == UNVISITED) {
                        top++;
                        stackNode[top] = next;
                        stackCursor[top] = 0;
                        stackPosition[next] = top;
                        state[next] = ON_STACK;
                    } else if (state[next] == ON_STACK) {
                        feedback[edge] = true;
                        discovered.add(edge);
                        cycles.add(reconstructCycle(stackNode, stackPosition[next], top));
                        log.debug("[Layering] Back edge {} ({} -> {}) excluded from layering",
                                graph.edgeId(edge), graph.nodeId(node), graph.nodeId(next));
                    }
                }
            }
        }

        return new FeedbackEdges(feedback, discovered, cycles);
    }

    /**
     * The stack segment from the back edge's target to its source is exactly the cycle.
     */
    private List<Integer> reconstructCycle(int[] stackNode, int from, int to) {
        List<Integer> cycle = new ArrayList<>(to - from + 2);
        for (int i = from; i <= to; i++) {
            cycle.add(stackNode[i]);
        }
        cycle.add(stackNode[from]); // close the cycle
        return cycle;
    }
}
