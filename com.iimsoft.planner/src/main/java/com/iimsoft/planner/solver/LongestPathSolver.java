package com.iimsoft.planner.solver;

import com.iimsoft.planner.graph.DependencyGraph;
import com.iimsoft.planner.graph.Edge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 关键路径（CPM）：标号修正法（Ford）求最早/最迟时间。
 *
 * - 最早：所有标号初始 0，反复扫描每条边 (u,v,w)，label[v] = max(label[v], label[u] + w)，直到一整轮没有变化
 * - 最迟：所有标号初始 earliest[sink]，在反向图上做同样的松弛，取 min(label[u], label[v] - w)
 * - 时差：late - early，时差为 0 的内部节点即关键任务
 *
 * 不要求节点按拓扑序编号。松弛轮数上限为 passFactor * 节点数，无环图上触顶说明逻辑有错，直接抛异常。
 */
public class LongestPathSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(LongestPathSolver.class);

    public static final int DEFAULT_PASS_FACTOR = 10;

    private final int passFactor;
    // >0 时覆盖 passFactor * nodeCount
    private final int fixedPassLimit;
    private final CycleDetector cycleDetector = new CycleDetector();

    public LongestPathSolver() {
        this(DEFAULT_PASS_FACTOR, 0);
    }

    public LongestPathSolver(int passFactor) {
        this(passFactor, 0);
    }

    private LongestPathSolver(int passFactor, int fixedPassLimit) {
        if (passFactor < 1) {
            throw new IllegalArgumentException("passFactor must be >= 1: " + passFactor);
        }
        this.passFactor = passFactor;
        this.fixedPassLimit = fixedPassLimit;
    }

    /** 固定轮数上限，不随节点数变化 */
    public static LongestPathSolver withPassLimit(int maxPasses) {
        return new LongestPathSolver(DEFAULT_PASS_FACTOR, maxPasses);
    }

    public PathAnalysis solve(DependencyGraph graph) {
        if (graph == null || graph.isEmpty()) {
            return PathAnalysis.empty();
        }

        List<Integer> cycle = cycleDetector.findCycle(graph);
        if (!cycle.isEmpty()) {
            List<Long> taskIds = new ArrayList<>();
            for (Integer node : cycle) {
                Long taskId = graph.taskAt(node);
                if (taskId != null) {
                    taskIds.add(taskId);
                }
            }
            throw new CyclicDependencyException(taskIds);
        }

        int[] early = earlyTimes(graph);
        int[] late = lateTimes(graph, early);

        int n = early.length;
        int[] slack = new int[n];
        for (int i = 0; i < n; i++) {
            slack[i] = late[i] - early[i];
        }

        List<Long> critical = new ArrayList<>();
        for (int node = 0; node < n; node++) {
            if (slack[node] == 0 && graph.isInterior(node)) {
                Long taskId = graph.taskAt(node);
                if (taskId != null) {
                    critical.add(taskId);
                }
            }
        }

        LOGGER.debug("CPM solved: {} nodes, earliest[sink]={}, critical={}", n, early[n - 1], critical);
        return new PathAnalysis(early, late, slack, critical);
    }

    int[] earlyTimes(DependencyGraph graph) {
        int n = graph.nodeCount();
        int[] label = new int[n];
        int maxPasses = maxPasses(n);

        int passes = 0;
        boolean changed = true;
        while (changed) {
            if (passes >= maxPasses) {
                throw new RelaxationLimitExceededException("Forward", passes, n);
            }
            changed = false;
            passes++;
            for (int node = 0; node < n; node++) {
                for (Edge e : graph.edgesFrom(node)) {
                    int v = e.getTo();
                    if (v < 0 || v >= n) {
                        continue;
                    }
                    int candidate = label[node] + e.getWeight();
                    if (candidate > label[v]) {
                        label[v] = candidate;
                        changed = true;
                    }
                }
            }
        }
        LOGGER.trace("Forward relaxation converged after {} passes", passes);
        return label;
    }

    int[] lateTimes(DependencyGraph graph, int[] early) {
        int n = early.length;
        int projectEnd = early[n - 1];
        int[] label = new int[n];
        Arrays.fill(label, projectEnd);

        // 反向图：v -> [(u, w)]
        List<List<Edge>> reverse = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            reverse.add(new ArrayList<>());
        }
        for (Edge e : graph.allEdges()) {
            if (e.getTo() >= 0 && e.getTo() < n) {
                reverse.get(e.getTo()).add(e);
            }
        }

        int maxPasses = maxPasses(n);
        int passes = 0;
        boolean changed = true;
        while (changed) {
            if (passes >= maxPasses) {
                throw new RelaxationLimitExceededException("Backward", passes, n);
            }
            changed = false;
            passes++;
            for (int node = n - 1; node >= 0; node--) {
                for (Edge e : reverse.get(node)) {
                    int u = e.getFrom();
                    if (u < 0 || u >= n) {
                        continue;
                    }
                    int candidate = label[node] - e.getWeight();
                    if (candidate < label[u]) {
                        label[u] = candidate;
                        changed = true;
                    }
                }
            }
        }
        LOGGER.trace("Backward relaxation converged after {} passes", passes);
        return label;
    }

    private int maxPasses(int nodeCount) {
        if (fixedPassLimit > 0) {
            return fixedPassLimit;
        }
        return (int) Math.min(Integer.MAX_VALUE, (long) passFactor * nodeCount);
    }
}
