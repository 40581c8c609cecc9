package com.iimsoft.planner.api.dto;

import java.util.List;
import java.util.Map;

public class ScheduleResponse {

    /** 为空表示成功 */
    public String error;
    public String errorMessage;

    public int calendarDuration;
    public int workdayDuration;

    /** 关键任务（按节点编号） */
    public List<Long> criticalPath;
    /** 关键链（按时间先后） */
    public List<Long> criticalChain;

    /** 每个输入任务一条，日期未定时 startDate/endDate 为空 */
    public List<TaskResult> tasks;

    /** 下标 = 节点编号（0 源点，最后一个汇点） */
    public List<Integer> earlyTimes;
    public List<Integer> lateTimes;
    public List<Integer> slack;

    public Map<Long, List<Long>> dependencies;

    /** personId -> 分配的天数 */
    public Map<Long, Integer> workload;

    public List<WarningDto> warnings;

    public static class TaskResult {
        public Long taskId;
        public String name;
        public Long parentId;

        public String startDate; // YYYY-MM-DD
        public String endDate;

        public Integer duration;
        public Integer durationCalendarDays; // end-start+1（含休息日）

        public Long employeeId;
        public boolean critical;
    }

    public static class WarningDto {
        public Long taskId;
        public String code;
        public String message;
    }
}
