package com.iimsoft.planner.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次排程用的依赖图：每个任务一个节点，外加虚拟源点 0 和汇点 sink（最大任务节点 + 1）。
 * 每次排程重新构建，不持久化。
 */
public class DependencyGraph {

    public static final int SOURCE = 0;

    private final Map<Integer, List<Edge>> adjacency = new LinkedHashMap<>();
    private final Map<Long, Integer> nodeByTask = new LinkedHashMap<>();
    private final Map<Integer, Long> taskByNode = new LinkedHashMap<>();

    // 任务 -> 已过滤的前置任务（只含图里存在的任务）
    private final Map<Long, List<Long>> dependencies = new LinkedHashMap<>();

    private int sink = -1;

    public static DependencyGraph empty() {
        return new DependencyGraph();
    }

    void registerTask(Long taskId, int node) {
        nodeByTask.put(taskId, node);
        taskByNode.put(node, taskId);
    }

    void initNodes(int sinkNode) {
        this.sink = sinkNode;
        for (int n = SOURCE; n <= sinkNode; n++) {
            adjacency.putIfAbsent(n, new ArrayList<>());
        }
    }

    void addEdge(int from, int to, int weight) {
        adjacency.computeIfAbsent(from, k -> new ArrayList<>()).add(new Edge(from, to, weight));
    }

    void putDependencies(Long taskId, List<Long> predecessorIds) {
        dependencies.put(taskId, Collections.unmodifiableList(new ArrayList<>(predecessorIds)));
    }

    public boolean isEmpty() {
        return nodeByTask.isEmpty();
    }

    public int getSink() {
        return sink;
    }

    /** 含源点与汇点 */
    public int nodeCount() {
        return isEmpty() ? 0 : sink + 1;
    }

    public List<Edge> edgesFrom(int node) {
        return adjacency.getOrDefault(node, List.of());
    }

    public List<Edge> allEdges() {
        List<Edge> out = new ArrayList<>();
        for (List<Edge> edges : adjacency.values()) {
            out.addAll(edges);
        }
        return out;
    }

    public Map<Integer, List<Edge>> getAdjacency() {
        return Collections.unmodifiableMap(adjacency);
    }

    public Integer nodeOf(Long taskId) {
        return nodeByTask.get(taskId);
    }

    /** 源点、汇点返回 null */
    public Long taskAt(int node) {
        return taskByNode.get(node);
    }

    public Map<Long, Integer> getNodeByTask() {
        return Collections.unmodifiableMap(nodeByTask);
    }

    public Map<Long, List<Long>> getDependencies() {
        return Collections.unmodifiableMap(dependencies);
    }

    public boolean isInterior(int node) {
        return node > SOURCE && node < sink;
    }
}
