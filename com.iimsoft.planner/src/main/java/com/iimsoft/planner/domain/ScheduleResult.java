package com.iimsoft.planner.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次排程的完整输出。要么带数据，要么带 error 标记，不会两者都有。
 *
 * taskDates 里缺失的任务表示“日期未定”，不是 0 天。
 */
public class ScheduleResult {

    private ScheduleError error;
    private String errorMessage;

    // 日历天（含首尾）
    private int calendarDuration;
    // earliest[sink]
    private int workdayDuration;

    // 按节点编号排列，不保证时间顺序
    private List<Long> criticalPath = new ArrayList<>();
    // 按时间顺序从头到尾
    private List<Long> criticalChain = new ArrayList<>();

    private Map<Long, DateRange> taskDates = new LinkedHashMap<>();

    private List<Integer> earlyTimes = new ArrayList<>();
    private List<Integer> lateTimes = new ArrayList<>();
    private List<Integer> slack = new ArrayList<>();

    private Map<Long, List<Long>> dependencies = new LinkedHashMap<>();

    // taskId -> personId
    private Map<Long, Long> assignments = new LinkedHashMap<>();
    // personId -> 分配的天数
    private Map<Long, Integer> workload = new LinkedHashMap<>();
    // 原负责人不可用、又没找到别人的任务，负责人已清空
    private List<Long> releasedAssignments = new ArrayList<>();

    private List<ScheduleWarning> warnings = new ArrayList<>();

    public static ScheduleResult empty() {
        return new ScheduleResult();
    }

    public static ScheduleResult failed(ScheduleError error, String errorMessage) {
        ScheduleResult r = new ScheduleResult();
        r.error = error;
        r.errorMessage = errorMessage;
        return r;
    }

    public boolean isSuccessful() {
        return error == null;
    }

    public List<ScheduleWarning> warningsFor(Long taskId) {
        List<ScheduleWarning> out = new ArrayList<>();
        for (ScheduleWarning w : warnings) {
            if (taskId.equals(w.getTaskId())) {
                out.add(w);
            }
        }
        return out;
    }

    public boolean hasWarning(Long taskId, WarningCode code) {
        return warningsFor(taskId).stream().anyMatch(w -> w.getCode() == code);
    }

    public ScheduleError getError() { return error; }
    public void setError(ScheduleError error) { this.error = error; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public int getCalendarDuration() { return calendarDuration; }
    public void setCalendarDuration(int calendarDuration) { this.calendarDuration = calendarDuration; }
    public int getWorkdayDuration() { return workdayDuration; }
    public void setWorkdayDuration(int workdayDuration) { this.workdayDuration = workdayDuration; }
    public List<Long> getCriticalPath() { return criticalPath; }
    public void setCriticalPath(List<Long> criticalPath) { this.criticalPath = criticalPath; }
    public List<Long> getCriticalChain() { return criticalChain; }
    public void setCriticalChain(List<Long> criticalChain) { this.criticalChain = criticalChain; }
    public Map<Long, DateRange> getTaskDates() { return taskDates; }
    public void setTaskDates(Map<Long, DateRange> taskDates) { this.taskDates = taskDates; }
    public List<Integer> getEarlyTimes() { return earlyTimes; }
    public void setEarlyTimes(List<Integer> earlyTimes) { this.earlyTimes = earlyTimes; }
    public List<Integer> getLateTimes() { return lateTimes; }
    public void setLateTimes(List<Integer> lateTimes) { this.lateTimes = lateTimes; }
    public List<Integer> getSlack() { return slack; }
    public void setSlack(List<Integer> slack) { this.slack = slack; }
    public Map<Long, List<Long>> getDependencies() { return dependencies; }
    public void setDependencies(Map<Long, List<Long>> dependencies) { this.dependencies = dependencies; }
    public Map<Long, Long> getAssignments() { return assignments; }
    public void setAssignments(Map<Long, Long> assignments) { this.assignments = assignments; }
    public Map<Long, Integer> getWorkload() { return workload; }
    public void setWorkload(Map<Long, Integer> workload) { this.workload = workload; }
    public List<Long> getReleasedAssignments() { return releasedAssignments; }
    public void setReleasedAssignments(List<Long> releasedAssignments) { this.releasedAssignments = releasedAssignments; }
    public List<ScheduleWarning> getWarnings() { return warnings; }
    public void setWarnings(List<ScheduleWarning> warnings) { this.warnings = warnings; }
}
