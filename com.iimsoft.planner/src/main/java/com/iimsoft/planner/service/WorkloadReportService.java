package com.iimsoft.planner.service;

import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.service.port.TaskSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 按人汇总工作量（读已落库的排程结果）。
 */
public class WorkloadReportService {

    private final TaskSource taskSource;

    public WorkloadReportService(TaskSource taskSource) {
        this.taskSource = Objects.requireNonNull(taskSource, "taskSource");
    }

    /** personId -> 工作量，按人第一次出现的顺序 */
    public Map<Long, PersonWorkload> workloadByPerson(Long projectId) {
        List<Task> tasks = taskSource.listAllTasks(projectId);
        Map<Long, Task> byId = new HashMap<>();
        for (Task t : tasks) {
            byId.put(t.getId(), t);
        }

        Map<Long, PersonWorkload> out = new LinkedHashMap<>();
        for (Task t : tasks) {
            if (t.isGroup() || t.getEmployeeId() == null) {
                continue;
            }
            Integer wd = t.getWorkingDuration();
            PersonWorkload.Entry entry = new PersonWorkload.Entry(t.getId(), displayName(t, byId),
                    t.getStartDate(), t.getEndDate(), wd == null ? 0 : wd, t.isParallel());
            out.computeIfAbsent(t.getEmployeeId(), PersonWorkload::new).add(entry);
        }
        return out;
    }

    /** 此人在 [from, to] 内有交集的任务；没有日期的任务不算 */
    public List<PersonWorkload.Entry> tasksOverlapping(Long projectId, Long personId, LocalDate from, LocalDate to) {
        List<PersonWorkload.Entry> out = new ArrayList<>();
        PersonWorkload workload = workloadByPerson(projectId).get(personId);
        if (workload == null) {
            return out;
        }
        for (PersonWorkload.Entry e : workload.getTasks()) {
            if (e.getStartDate() == null || e.getEndDate() == null) {
                continue;
            }
            if (!e.getEndDate().isBefore(from) && !e.getStartDate().isAfter(to)) {
                out.add(e);
            }
        }
        return out;
    }

    private String displayName(Task task, Map<Long, Task> byId) {
        if (!task.isSubtask()) {
            return task.getName();
        }
        Task parent = byId.get(task.getParentId());
        if (parent == null) {
            parent = taskSource.getTask(task.getParentId());
        }
        return parent == null ? task.getName() : parent.getName() + " - " + task.getName();
    }
}
