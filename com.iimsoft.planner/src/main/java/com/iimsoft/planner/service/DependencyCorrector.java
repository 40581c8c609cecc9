package com.iimsoft.planner.service;

import com.iimsoft.planner.domain.DateRange;
import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.mapping.CalendarDayMappingPolicy;
import com.iimsoft.planner.mapping.DateMappingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 日期校正：保证每个任务的 start 严格晚于所有前置任务的 end。
 *
 * 1) Kahn 拓扑排序（按已知前置数量），队列空了还剩下的任务（环上的）追加到末尾
 * 2) 按顺序检查：start <= 前置最晚 end 时，从前置最晚 end 的第二天起用映射策略重排，end 按任务自己的 duration 重算
 *    （跳休息日时 start 落到第二天或之后的第一个工作日）
 * 3) 挪动后沿后继关系级联检查，直到不再有挪动
 *
 * 没有日期的任务不参与比较。输入不修改，返回新的 map；已经一致的输入原样返回。
 */
public class DependencyCorrector {

    private static final Logger LOGGER = LoggerFactory.getLogger(DependencyCorrector.class);

    private final DateMappingPolicy policy;

    /** 按日历天重排 */
    public DependencyCorrector() {
        this(new CalendarDayMappingPolicy());
    }

    public DependencyCorrector(DateMappingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * 不知道任务本身时，duration 取当前区间的日历天数。
     */
    public Map<Long, DateRange> correct(Map<Long, DateRange> dates,
                                        Map<Long, ? extends Collection<Long>> dependencies) {
        return correct(dates, dependencies, Map.of());
    }

    /**
     * @param dates        taskId -> 当前日期
     * @param dependencies taskId -> 前置任务
     * @param tasks        taskId -> 任务（取 duration 和负责人日历）
     */
    public Map<Long, DateRange> correct(Map<Long, DateRange> dates,
                                        Map<Long, ? extends Collection<Long>> dependencies,
                                        Map<Long, Task> tasks) {
        Map<Long, DateRange> corrected = new LinkedHashMap<>(dates);
        if (corrected.isEmpty()) {
            return corrected;
        }

        Set<Long> taskIds = new LinkedHashSet<>(dependencies.keySet());
        taskIds.addAll(dates.keySet());

        Map<Long, List<Long>> successors = new LinkedHashMap<>();
        for (Long taskId : taskIds) {
            for (Long pred : predecessorsOf(taskId, dependencies)) {
                if (taskIds.contains(pred)) {
                    successors.computeIfAbsent(pred, k -> new ArrayList<>()).add(taskId);
                }
            }
        }

        int shifts = 0;
        long guard = (long) taskIds.size() * taskIds.size() + taskIds.size();
        for (Long taskId : topologicalOrder(taskIds, dependencies, successors)) {
            if (!shiftIfViolated(taskId, corrected, dependencies, tasks)) {
                continue;
            }
            shifts++;
            // 级联
            Deque<Long> queue = new ArrayDeque<>(successors.getOrDefault(taskId, List.of()));
            long steps = 0;
            while (!queue.isEmpty()) {
                if (++steps > guard) {
                    LOGGER.warn("Cascade from task {} stopped after {} steps", taskId, guard);
                    break;
                }
                Long next = queue.poll();
                if (shiftIfViolated(next, corrected, dependencies, tasks)) {
                    shifts++;
                    queue.addAll(successors.getOrDefault(next, List.of()));
                }
            }
        }
        if (shifts > 0) {
            LOGGER.info("Dependency correction shifted tasks {} time(s)", shifts);
        }
        return corrected;
    }

    private boolean shiftIfViolated(Long taskId, Map<Long, DateRange> dates,
                                    Map<Long, ? extends Collection<Long>> dependencies, Map<Long, Task> tasks) {
        DateRange current = dates.get(taskId);
        if (current == null) {
            return false;
        }
        LocalDate latestPredEnd = null;
        for (Long pred : predecessorsOf(taskId, dependencies)) {
            DateRange p = dates.get(pred);
            if (p != null && (latestPredEnd == null || p.getEnd().isAfter(latestPredEnd))) {
                latestPredEnd = p.getEnd();
            }
        }
        if (latestPredEnd == null || current.getStart().isAfter(latestPredEnd)) {
            return false;
        }
        DateRange shifted = reschedule(taskId, current, latestPredEnd.plusDays(1), tasks);
        LOGGER.info("Task {} shifted {} -> {} (predecessors end {})", taskId, current, shifted, latestPredEnd);
        dates.put(taskId, shifted);
        return true;
    }

    private DateRange reschedule(Long taskId, DateRange current, LocalDate notBefore, Map<Long, Task> tasks) {
        Task task = tasks.get(taskId);
        if (task == null) {
            return current.shiftTo(notBefore);
        }
        DateRange shifted = policy.shift(task, notBefore);
        if (shifted == null) {
            LOGGER.warn("{} could not be rescheduled from {}, keeping its calendar span", task.getLabel(), notBefore);
            return current.shiftTo(notBefore);
        }
        return shifted;
    }

    List<Long> topologicalOrder(Set<Long> taskIds, Map<Long, ? extends Collection<Long>> dependencies,
                                Map<Long, List<Long>> successors) {
        Map<Long, Integer> inDegree = new LinkedHashMap<>();
        for (Long taskId : taskIds) {
            int known = 0;
            for (Long pred : predecessorsOf(taskId, dependencies)) {
                if (taskIds.contains(pred)) {
                    known++;
                }
            }
            inDegree.put(taskId, known);
        }

        Deque<Long> queue = new ArrayDeque<>();
        for (Map.Entry<Long, Integer> e : inDegree.entrySet()) {
            if (e.getValue() == 0) {
                queue.add(e.getKey());
            }
        }
        List<Long> order = new ArrayList<>();
        Set<Long> placed = new LinkedHashSet<>();
        while (!queue.isEmpty()) {
            Long taskId = queue.poll();
            order.add(taskId);
            placed.add(taskId);
            for (Long succ : successors.getOrDefault(taskId, List.of())) {
                int left = inDegree.merge(succ, -1, Integer::sum);
                if (left == 0) {
                    queue.add(succ);
                }
            }
        }
        if (order.size() < taskIds.size()) {
            List<Long> leftovers = new ArrayList<>();
            for (Long taskId : taskIds) {
                if (!placed.contains(taskId)) {
                    leftovers.add(taskId);
                }
            }
            LOGGER.warn("Tasks {} are on a dependency cycle, appended after the topological order", leftovers);
            order.addAll(leftovers);
        }
        return order;
    }

    private static Collection<Long> predecessorsOf(Long taskId, Map<Long, ? extends Collection<Long>> dependencies) {
        Collection<Long> preds = dependencies.get(taskId);
        return preds == null ? List.of() : preds;
    }
}
