package com.iimsoft.planner.service;

import com.iimsoft.planner.calendar.WorkCalendarConfig;
import com.iimsoft.planner.domain.DateRange;
import com.iimsoft.planner.domain.Person;
import com.iimsoft.planner.domain.Project;
import com.iimsoft.planner.domain.ScheduleError;
import com.iimsoft.planner.domain.ScheduleResult;
import com.iimsoft.planner.domain.ScheduleWarning;
import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.domain.WarningCode;
import com.iimsoft.planner.graph.DependencyGraph;
import com.iimsoft.planner.graph.DependencyGraphBuilder;
import com.iimsoft.planner.mapping.CalendarMapper;
import com.iimsoft.planner.mapping.DateMappingPolicy;
import com.iimsoft.planner.service.port.PersonDirectory;
import com.iimsoft.planner.solver.CriticalChainTracer;
import com.iimsoft.planner.solver.CyclicDependencyException;
import com.iimsoft.planner.solver.LongestPathSolver;
import com.iimsoft.planner.solver.PathAnalysis;
import com.iimsoft.planner.solver.RelaxationLimitExceededException;
import com.iimsoft.planner.solver.ScheduleMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 一次排程的完整流程：
 * 建图 -> 最长路 -> 映射日期 -> 依赖校正 -> 人员分配 -> 再校正 -> 子任务排期 -> 汇总结果。
 *
 * 调用方传入的 Task 不会被修改，所有计算都在副本上进行。
 * 结构性错误（环、松弛不收敛）不会抛出，结果里带 error。
 */
public class ScheduleOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScheduleOrchestrator.class);

    private final WorkCalendarConfig config;
    private final LongestPathSolver solver;
    private final DependencyGraphBuilder graphBuilder = new DependencyGraphBuilder();
    private final CriticalChainTracer chainTracer = new CriticalChainTracer();

    public ScheduleOrchestrator() {
        this(WorkCalendarConfig.load());
    }

    public ScheduleOrchestrator(WorkCalendarConfig config) {
        this(config, new LongestPathSolver());
    }

    public ScheduleOrchestrator(WorkCalendarConfig config, LongestPathSolver solver) {
        this.config = config == null ? WorkCalendarConfig.defaults() : config;
        this.solver = Objects.requireNonNull(solver, "solver");
    }

    /** 不考虑休息日，也不分配人员 */
    public ScheduleResult computeSchedule(Project project, List<Task> tasks) {
        return computeSchedule(project, tasks, null);
    }

    public ScheduleResult computeSchedule(Project project, List<Task> tasks, PersonDirectory directory) {
        Objects.requireNonNull(project, "project");
        if (project.getStartDate() == null) {
            throw new IllegalArgumentException("project.startDate 不能为空");
        }
        if (tasks == null || tasks.isEmpty()) {
            LOGGER.info("{}: no tasks to schedule", project.getLabel());
            return ScheduleResult.empty();
        }

        // 0) 副本 + 拆分顶层任务 / 子任务
        List<Task> topLevel = new ArrayList<>();
        Map<Long, List<Task>> subtasksByParent = new LinkedHashMap<>();
        for (Task t : tasks) {
            if (t == null) {
                continue;
            }
            Task copy = t.copy();
            if (copy.isSubtask()) {
                subtasksByParent.computeIfAbsent(copy.getParentId(), k -> new ArrayList<>()).add(copy);
            } else {
                topLevel.add(copy);
            }
        }
        LOGGER.info("Scheduling {}: {} tasks, {} subtask groups, days-off aware={}",
                project.getLabel(), topLevel.size(), subtasksByParent.size(), directory != null);

        List<ScheduleWarning> warnings = new ArrayList<>();

        // 1) 建图
        DependencyGraph graph = graphBuilder.build(topLevel, warnings);
        if (graph.isEmpty()) {
            ScheduleResult empty = ScheduleResult.empty();
            empty.setWarnings(warnings);
            return empty;
        }
        // 建图时跳过的任务（重复 id、缺 duration）后面也不再参与
        topLevel = acceptedBy(graph, topLevel);
        Map<Long, Task> tasksById = new LinkedHashMap<>();
        for (Task t : topLevel) {
            tasksById.put(t.getId(), t);
        }

        // 2) 最长路
        PathAnalysis analysis;
        try {
            analysis = solver.solve(graph);
        } catch (CyclicDependencyException e) {
            LOGGER.error("{}: {}", project.getLabel(), e.getMessage());
            return failed(ScheduleError.CYCLIC_DEPENDENCY, e.getMessage(), warnings);
        } catch (RelaxationLimitExceededException e) {
            LOGGER.error("{}: {}", project.getLabel(), e.getMessage());
            return failed(ScheduleError.RELAXATION_LIMIT_EXCEEDED, e.getMessage(), warnings);
        }

        // 3) 映射日期 + 校正
        DateMappingPolicy policy = DateMappingPolicy.forDirectory(directory, config);
        DependencyCorrector corrector = new DependencyCorrector(policy);
        Map<Long, DateRange> dates = new CalendarMapper(policy)
                .map(topLevel, graph, analysis, project.getStartDate(), warnings);
        dates = corrector.correct(dates, graph.getDependencies(), tasksById);
        applyDates(topLevel, dates);

        // 4) 人员分配 + 再校正
        WorkloadLedger ledger = new WorkloadLedger();
        Map<Long, Long> assignments = new LinkedHashMap<>();
        Map<Long, Long> assigneeBefore = assigneesOf(topLevel, subtasksByParent);
        ResourceAllocator allocator = null;
        if (directory != null) {
            allocator = new ResourceAllocator(directory, config);
            for (Assignment a : allocator.allocate(topLevel, ledger, warnings)) {
                assignments.put(a.getTaskId(), a.getPersonId());
            }
            Map<Long, DateRange> allocated = collectDates(topLevel);
            Map<Long, DateRange> recorrected = corrector.correct(allocated, graph.getDependencies(), tasksById);
            applyDates(topLevel, recorrected);
            warnShiftedAssignees(topLevel, allocated, recorrected, directory, warnings);
            dates = recorrected;
        }

        // 5) 子任务
        SubtaskScheduler subtaskScheduler = new SubtaskScheduler(allocator);
        Map<Long, DateRange> allDates = new LinkedHashMap<>(dates);
        List<Task> scheduledSubtasks = new ArrayList<>();
        for (Task group : topLevel) {
            List<Task> subtasks = subtasksByParent.remove(group.getId());
            if (subtasks == null) {
                continue;
            }
            for (Assignment a : subtaskScheduler.schedule(group, subtasks, ledger, warnings)) {
                assignments.put(a.getTaskId(), a.getPersonId());
            }
            for (Task st : subtasks) {
                if (st.getDates() != null) {
                    allDates.put(st.getId(), st.getDates());
                }
            }
            scheduledSubtasks.addAll(subtasks);
        }
        for (Map.Entry<Long, List<Task>> orphan : subtasksByParent.entrySet()) {
            LOGGER.warn("Parent task {} not scheduled, skipping {} subtasks", orphan.getKey(), orphan.getValue().size());
            for (Task st : orphan.getValue()) {
                warnings.add(new ScheduleWarning(st.getId(), WarningCode.TASK_SKIPPED,
                        "parent task " + orphan.getKey() + " not found or not scheduled"));
            }
        }

        // 6) 汇总
        ScheduleResult result = new ScheduleResult();
        result.setTaskDates(allDates);
        result.setCriticalPath(new ArrayList<>(analysis.getCriticalTaskIds()));
        result.setCriticalChain(chainTracer.trace(dates, graph.getDependencies()));
        result.setEarlyTimes(PathAnalysis.toList(analysis.getEarlyTimes()));
        result.setLateTimes(PathAnalysis.toList(analysis.getLateTimes()));
        result.setSlack(PathAnalysis.toList(analysis.getSlack()));
        result.setDependencies(new LinkedHashMap<>(graph.getDependencies()));
        result.setAssignments(assignments);
        result.setWorkload(new LinkedHashMap<>(ledger.snapshot()));
        result.setReleasedAssignments(released(assigneeBefore, topLevel, scheduledSubtasks));
        result.setWarnings(warnings);
        result.setWorkdayDuration(analysis.getProjectDuration());
        int calendarDuration = ScheduleMetrics.calendarDuration(allDates);
        result.setCalendarDuration(calendarDuration > 0 ? calendarDuration : analysis.getProjectDuration());

        LOGGER.info("Scheduled {}: {} tasks dated, calendar duration {} days, critical path {}, {} warnings",
                project.getLabel(), allDates.size(), result.getCalendarDuration(),
                result.getCriticalPath(), warnings.size());
        return result;
    }

    private static ScheduleResult failed(ScheduleError error, String message, List<ScheduleWarning> warnings) {
        ScheduleResult r = ScheduleResult.failed(error, message);
        r.setWarnings(warnings);
        return r;
    }

    /** 图里有节点的任务，同一 id 只留第一个 */
    private static List<Task> acceptedBy(DependencyGraph graph, List<Task> tasks) {
        List<Task> out = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        for (Task t : tasks) {
            if (t.getId() != null && graph.nodeOf(t.getId()) != null && seen.add(t.getId())) {
                out.add(t);
            }
        }
        return out;
    }

    private static Map<Long, Long> assigneesOf(List<Task> topLevel, Map<Long, List<Task>> subtasksByParent) {
        Map<Long, Long> out = new LinkedHashMap<>();
        for (Task t : topLevel) {
            if (t.getEmployeeId() != null) {
                out.put(t.getId(), t.getEmployeeId());
            }
        }
        for (List<Task> subtasks : subtasksByParent.values()) {
            for (Task st : subtasks) {
                if (st.getId() != null && st.getEmployeeId() != null) {
                    out.putIfAbsent(st.getId(), st.getEmployeeId());
                }
            }
        }
        return out;
    }

    private static List<Long> released(Map<Long, Long> assigneeBefore, List<Task> topLevel, List<Task> subtasks) {
        List<Long> out = new ArrayList<>();
        List<Task> all = new ArrayList<>(topLevel);
        all.addAll(subtasks);
        for (Task t : all) {
            if (t.getEmployeeId() == null && assigneeBefore.containsKey(t.getId()) && !out.contains(t.getId())) {
                out.add(t.getId());
            }
        }
        return out;
    }

    private static void applyDates(List<Task> tasks, Map<Long, DateRange> dates) {
        for (Task t : tasks) {
            if (t.getId() != null && dates.containsKey(t.getId())) {
                t.setDates(dates.get(t.getId()));
            }
        }
    }

    private static Map<Long, DateRange> collectDates(List<Task> tasks) {
        Map<Long, DateRange> out = new LinkedHashMap<>();
        for (Task t : tasks) {
            DateRange r = t.getDates();
            if (t.getId() != null && r != null && !out.containsKey(t.getId())) {
                out.put(t.getId(), r);
            }
        }
        return out;
    }

    /** 再校正挪动了已分配的任务后，新日期落到此人的休息日上就告警 */
    private static void warnShiftedAssignees(List<Task> tasks, Map<Long, DateRange> before,
                                             Map<Long, DateRange> after, PersonDirectory directory,
                                             List<ScheduleWarning> warnings) {
        for (Task t : tasks) {
            DateRange now = after.get(t.getId());
            if (t.getEmployeeId() == null || now == null || now.equals(before.get(t.getId()))) {
                continue;
            }
            Person person = directory.getPerson(t.getEmployeeId());
            if (person != null && !ResourceAllocator.isAvailable(person, now)) {
                LOGGER.warn("{} shifted to {}, which includes days off for {}", t.getLabel(), now, person.getName());
                warnings.add(new ScheduleWarning(t.getId(), WarningCode.ASSIGNEE_UNAVAILABLE,
                        "shifted to " + now + " which includes days off for person " + person.getId()));
            }
        }
    }
}
