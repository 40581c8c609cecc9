package com.iimsoft.planner.solver;

import com.iimsoft.planner.graph.DependencyGraph;
import com.iimsoft.planner.graph.Edge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 深度优先找回边。用显式栈代替递归，大项目不会栈溢出。
 */
public class CycleDetector {

    private static final int WHITE = 0;
    private static final int ON_STACK = 1;
    private static final int DONE = 2;

    private static final class Frame {
        final int node;
        int nextEdge;

        Frame(int node) {
            this.node = node;
        }
    }

    public boolean hasCycle(DependencyGraph graph) {
        return !findCycle(graph).isEmpty();
    }

    /**
     * 返回环上的节点（按边的方向），无环时返回空列表。
     */
    public List<Integer> findCycle(DependencyGraph graph) {
        int n = graph.nodeCount();
        if (n == 0) {
            return Collections.emptyList();
        }
        int[] state = new int[n];
        List<Frame> path = new ArrayList<>();

        for (int root = 0; root < n; root++) {
            if (state[root] != WHITE) {
                continue;
            }
            path.add(new Frame(root));
            state[root] = ON_STACK;

            while (!path.isEmpty()) {
                Frame top = path.get(path.size() - 1);
                List<Edge> edges = graph.edgesFrom(top.node);
                if (top.nextEdge >= edges.size()) {
                    state[top.node] = DONE;
                    path.remove(path.size() - 1);
                    continue;
                }
                int next = edges.get(top.nextEdge++).getTo();
                if (next < 0 || next >= n) {
                    continue;
                }
                if (state[next] == ON_STACK) {
                    return cycleFrom(path, next);
                }
                if (state[next] == WHITE) {
                    state[next] = ON_STACK;
                    path.add(new Frame(next));
                }
            }
        }
        return Collections.emptyList();
    }

    private static List<Integer> cycleFrom(List<Frame> path, int entry) {
        List<Integer> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (Frame f : path) {
            if (f.node == entry) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(f.node);
            }
        }
        return cycle;
    }
}
