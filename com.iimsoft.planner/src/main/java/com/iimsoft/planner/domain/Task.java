package com.iimsoft.planner.domain;

import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 项目中的一个任务。两级结构：组任务（isGroup）下挂子任务（parentId 指向组任务），不再往下嵌套。
 *
 * predecessorIds 在进入排程之前就已经规范化为有序、去重的 id 集合；
 * 存储层给的原始格式解析失败时 predecessorsMalformed=true，集合为空。
 */
public class Task {
    private Long id;
    private String name;

    // 时间单位（天），null 或 <1 视为缺失
    private Integer duration;

    private boolean group;
    private boolean parallel;   // 只对组任务下的子任务有意义
    private Long parentId;

    private Long employeeId;
    private String position;    // 需要的岗位

    private Set<Long> predecessorIds = new LinkedHashSet<>();
    private boolean predecessorsMalformed;

    private LocalDate startDate;
    private LocalDate endDate;

    private Integer workingDuration;

    public Task() {}

    public Task(Long id, String name, Integer duration) {
        this.id = id; this.name = name; this.duration = duration;
    }

    public Task(Long id, String name, Integer duration, Collection<Long> predecessorIds) {
        this(id, name, duration);
        setPredecessorIds(predecessorIds);
    }

    /** 排程在副本上进行，不改调用方的对象 */
    public Task copy() {
        Task t = new Task(id, name, duration, predecessorIds);
        t.group = group;
        t.parallel = parallel;
        t.parentId = parentId;
        t.employeeId = employeeId;
        t.position = position;
        t.predecessorsMalformed = predecessorsMalformed;
        t.startDate = startDate;
        t.endDate = endDate;
        t.workingDuration = workingDuration;
        return t;
    }

    public boolean hasValidDuration() {
        return duration != null && duration >= 1;
    }

    public boolean isSubtask() {
        return parentId != null;
    }

    public boolean requiresAssignment() {
        return !group && position != null && !position.isBlank();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Integer getDuration() { return duration; }
    public void setDuration(Integer duration) { this.duration = duration; }
    public boolean isGroup() { return group; }
    public void setGroup(boolean group) { this.group = group; }
    public boolean isParallel() { return parallel; }
    public void setParallel(boolean parallel) { this.parallel = parallel; }
    public Long getParentId() { return parentId; }
    public void setParentId(Long parentId) { this.parentId = parentId; }
    public Long getEmployeeId() { return employeeId; }
    public void setEmployeeId(Long employeeId) { this.employeeId = employeeId; }
    public String getPosition() { return position; }
    public void setPosition(String position) { this.position = position; }

    public Set<Long> getPredecessorIds() { return predecessorIds; }
    public void setPredecessorIds(Collection<Long> predecessorIds) {
        this.predecessorIds = new LinkedHashSet<>();
        if (predecessorIds != null) {
            for (Long p : predecessorIds) {
                if (p != null) this.predecessorIds.add(p);
            }
        }
    }

    public boolean isPredecessorsMalformed() { return predecessorsMalformed; }
    public void setPredecessorsMalformed(boolean predecessorsMalformed) { this.predecessorsMalformed = predecessorsMalformed; }

    public LocalDate getStartDate() { return startDate; }
    public void setStartDate(LocalDate startDate) { this.startDate = startDate; }
    public LocalDate getEndDate() { return endDate; }
    public void setEndDate(LocalDate endDate) { this.endDate = endDate; }

    /** 工作量统计用的时长，未设置时等于 duration */
    public Integer getWorkingDuration() {
        return workingDuration != null ? workingDuration : duration;
    }
    public void setWorkingDuration(Integer workingDuration) { this.workingDuration = workingDuration; }

    public DateRange getDates() {
        return startDate == null || endDate == null || endDate.isBefore(startDate)
                ? null : DateRange.of(startDate, endDate);
    }

    public void setDates(DateRange range) {
        this.startDate = range == null ? null : range.getStart();
        this.endDate = range == null ? null : range.getEnd();
    }

    public String getLabel() {
        return name == null ? "Task " + id : "Task " + id + " '" + name + "'";
    }

    @Override
    public String toString() {
        return getLabel();
    }
}
