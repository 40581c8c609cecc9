package com.iimsoft.planner.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public class ScheduleRequest {

    public ProjectDto project;

    /** 顶层任务和子任务平铺在一起，子任务用 parentId 指向组任务 */
    public List<TaskDto> tasks;

    /** 可选：不为空时按休息日排程并分配人员 */
    public List<PersonDto> persons;

    public static class ProjectDto {
        public Long id;
        public String name;
        public String startDate; // YYYY-MM-DD
    }

    public static class TaskDto {
        public Long id;
        public String name;
        public Integer duration;
        public boolean group;
        public boolean parallel;
        public Long parentId;
        public Long employeeId;
        public String position;
        /** [1,2] / "[1,2]" / "1,2" */
        public JsonNode predecessors;
        public Integer workingDuration;
    }

    public static class PersonDto {
        public Long id;
        public String name;
        public String position;
        /** 1=周一 ... 7=周日，格式同 predecessors */
        public JsonNode daysOff;
    }
}
