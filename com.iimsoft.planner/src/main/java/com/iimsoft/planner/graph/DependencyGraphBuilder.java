package com.iimsoft.planner.graph;

import com.iimsoft.planner.domain.ScheduleWarning;
import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.domain.WarningCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把平铺的任务列表转成带源点/汇点的依赖图。
 *
 * 规则：
 * - 按输入顺序给任务编号 1..N，0 为源点，N+1 为汇点
 * - 有前置：每个前置节点 -> 本任务节点，权重 = 本任务时长
 * - 无前置：源点 -> 本任务节点，权重 0
 * - 没有任何任务把它当前置：本任务节点 -> 汇点，权重 0
 * - 缺 id / duration 的任务跳过（记告警），不影响其他任务
 */
public class DependencyGraphBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    public DependencyGraph build(List<Task> tasks, List<ScheduleWarning> warnings) {
        DependencyGraph graph = new DependencyGraph();
        if (tasks == null || tasks.isEmpty()) {
            return graph;
        }

        // 1) 过滤并编号
        List<Task> accepted = new ArrayList<>();
        int node = 1;
        for (Task task : tasks) {
            if (task == null || task.getId() == null) {
                LOGGER.warn("Skipping task without id: {}", task);
                warnings.add(new ScheduleWarning(null, WarningCode.TASK_SKIPPED, "task has no id"));
                continue;
            }
            if (graph.nodeOf(task.getId()) != null) {
                LOGGER.warn("Skipping duplicate task id {}", task.getId());
                warnings.add(new ScheduleWarning(task.getId(), WarningCode.TASK_SKIPPED, "duplicate task id"));
                continue;
            }
            if (!task.hasValidDuration()) {
                LOGGER.warn("Skipping {}: missing or non-positive duration {}", task.getLabel(), task.getDuration());
                warnings.add(new ScheduleWarning(task.getId(), WarningCode.TASK_SKIPPED,
                        "missing or non-positive duration"));
                continue;
            }
            graph.registerTask(task.getId(), node++);
            accepted.add(task);
        }
        if (accepted.isEmpty()) {
            return graph;
        }
        int sink = node;
        graph.initNodes(sink);

        // 2) 规范化前置 + 统计“被依赖”
        Map<Long, List<Long>> predecessorsByTask = new LinkedHashMap<>();
        Set<Long> hasDependents = new HashSet<>();
        for (Task task : accepted) {
            if (task.isPredecessorsMalformed()) {
                LOGGER.warn("{} has unparseable predecessors, treating as none", task.getLabel());
                warnings.add(new ScheduleWarning(task.getId(), WarningCode.UNPARSEABLE_PREDECESSORS,
                        "predecessors could not be decoded"));
            }
            List<Long> known = new ArrayList<>();
            for (Long predId : task.getPredecessorIds()) {
                if (graph.nodeOf(predId) == null) {
                    LOGGER.warn("{} references unknown predecessor {}, ignoring edge", task.getLabel(), predId);
                    warnings.add(new ScheduleWarning(task.getId(), WarningCode.UNKNOWN_PREDECESSOR,
                            "unknown predecessor " + predId));
                    continue;
                }
                known.add(predId);
                hasDependents.add(predId);
            }
            predecessorsByTask.put(task.getId(), known);
            graph.putDependencies(task.getId(), known);
        }

        // 3) 连边
        for (Task task : accepted) {
            int taskNode = graph.nodeOf(task.getId());
            List<Long> preds = predecessorsByTask.get(task.getId());
            if (preds.isEmpty()) {
                graph.addEdge(DependencyGraph.SOURCE, taskNode, 0);
            } else {
                for (Long predId : preds) {
                    graph.addEdge(graph.nodeOf(predId), taskNode, task.getDuration());
                }
            }
            if (!hasDependents.contains(task.getId())) {
                graph.addEdge(taskNode, sink, 0);
            }
        }

        LOGGER.debug("Built dependency graph: {} task nodes, sink={}, {} edges",
                accepted.size(), sink, graph.allEdges().size());
        return graph;
    }
}
