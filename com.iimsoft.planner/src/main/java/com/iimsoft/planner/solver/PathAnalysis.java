package com.iimsoft.planner.solver;

import com.iimsoft.planner.graph.DependencyGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * 最长路求解结果，数组下标即节点编号。
 */
public class PathAnalysis {

    private final int[] earlyTimes;
    private final int[] lateTimes;
    private final int[] slack;
    private final List<Long> criticalTaskIds;

    public PathAnalysis(int[] earlyTimes, int[] lateTimes, int[] slack, List<Long> criticalTaskIds) {
        this.earlyTimes = earlyTimes;
        this.lateTimes = lateTimes;
        this.slack = slack;
        this.criticalTaskIds = criticalTaskIds;
    }

    public static PathAnalysis empty() {
        return new PathAnalysis(new int[0], new int[0], new int[0], new ArrayList<>());
    }

    public int earlyTimeOf(DependencyGraph graph, Long taskId) {
        Integer node = graph.nodeOf(taskId);
        return node == null ? 0 : earlyTimes[node];
    }

    /** earliest[sink] */
    public int getProjectDuration() {
        return earlyTimes.length == 0 ? 0 : earlyTimes[earlyTimes.length - 1];
    }

    public int[] getEarlyTimes() { return earlyTimes; }
    public int[] getLateTimes() { return lateTimes; }
    public int[] getSlack() { return slack; }
    public List<Long> getCriticalTaskIds() { return criticalTaskIds; }

    public static List<Integer> toList(int[] values) {
        List<Integer> out = new ArrayList<>(values.length);
        for (int v : values) {
            out.add(v);
        }
        return out;
    }
}
