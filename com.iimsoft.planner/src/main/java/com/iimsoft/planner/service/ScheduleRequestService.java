package com.iimsoft.planner.service;

import com.iimsoft.planner.api.dto.ScheduleRequest;
import com.iimsoft.planner.api.dto.ScheduleResponse;
import com.iimsoft.planner.domain.DateRange;
import com.iimsoft.planner.domain.Person;
import com.iimsoft.planner.domain.Project;
import com.iimsoft.planner.domain.ScheduleResult;
import com.iimsoft.planner.domain.ScheduleWarning;
import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.persistence.DaysOffCodec;
import com.iimsoft.planner.persistence.InMemoryPersonDirectory;
import com.iimsoft.planner.persistence.PredecessorCodec;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * JSON 请求 -> 领域对象 -> 排程 -> JSON 响应。
 */
public class ScheduleRequestService {

    private final ScheduleOrchestrator orchestrator;

    public ScheduleRequestService() {
        this(new ScheduleOrchestrator());
    }

    public ScheduleRequestService(ScheduleOrchestrator orchestrator) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    }

    public ScheduleResponse schedule(ScheduleRequest request) {
        Objects.requireNonNull(request, "request");
        LocalDate startDate = validateRequest(request);

        // 1) 领域对象
        Project project = new Project(request.project.id, request.project.name, startDate);
        List<Task> tasks = buildTasks(request.tasks);
        InMemoryPersonDirectory directory = buildDirectory(request.persons);

        // 2) 排程
        ScheduleResult result = directory == null
                ? orchestrator.computeSchedule(project, tasks)
                : orchestrator.computeSchedule(project, tasks, directory);

        // 3) 响应
        return buildResponse(tasks, result);
    }

    private static LocalDate validateRequest(ScheduleRequest request) {
        if (request.project == null) {
            throw new IllegalArgumentException("request.project 不能为空");
        }
        if (request.project.startDate == null || request.project.startDate.isBlank()) {
            throw new IllegalArgumentException("request.project.startDate 不能为空");
        }
        LocalDate startDate;
        try {
            startDate = LocalDate.parse(request.project.startDate.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("request.project.startDate 格式应为 YYYY-MM-DD：" + request.project.startDate, e);
        }
        if (request.tasks == null) {
            throw new IllegalArgumentException("request.tasks 不能为空");
        }
        if (request.persons != null) {
            Set<Long> ids = new HashSet<>();
            for (ScheduleRequest.PersonDto p : request.persons) {
                if (p == null || p.id == null) {
                    throw new IllegalArgumentException("request.persons 中存在缺少 id 的人员");
                }
                if (!ids.add(p.id)) {
                    throw new IllegalArgumentException("request.persons 中人员 id 重复：" + p.id);
                }
            }
        }
        return startDate;
    }

    private static List<Task> buildTasks(List<ScheduleRequest.TaskDto> dtos) {
        List<Task> tasks = new ArrayList<>();
        for (ScheduleRequest.TaskDto dto : dtos) {
            if (dto == null) {
                continue;
            }
            Task t = new Task(dto.id, dto.name, dto.duration);
            t.setGroup(dto.group);
            t.setParallel(dto.parallel);
            t.setParentId(dto.parentId);
            t.setEmployeeId(dto.employeeId);
            t.setPosition(dto.position);
            t.setWorkingDuration(dto.workingDuration);
            PredecessorCodec.applyTo(t, dto.predecessors);
            tasks.add(t);
        }
        return tasks;
    }

    private static InMemoryPersonDirectory buildDirectory(List<ScheduleRequest.PersonDto> dtos) {
        if (dtos == null || dtos.isEmpty()) {
            return null;
        }
        InMemoryPersonDirectory directory = new InMemoryPersonDirectory();
        for (ScheduleRequest.PersonDto dto : dtos) {
            Person p = new Person(dto.id, dto.name, dto.position, null);
            DaysOffCodec.applyTo(p, dto.daysOff);
            directory.add(p);
        }
        return directory;
    }

    private static ScheduleResponse buildResponse(List<Task> tasks, ScheduleResult result) {
        ScheduleResponse resp = new ScheduleResponse();
        if (!result.isSuccessful()) {
            resp.error = result.getError().getTag();
            resp.errorMessage = result.getErrorMessage();
        }
        resp.calendarDuration = result.getCalendarDuration();
        resp.workdayDuration = result.getWorkdayDuration();
        resp.criticalPath = result.getCriticalPath();
        resp.criticalChain = result.getCriticalChain();
        resp.earlyTimes = result.getEarlyTimes();
        resp.lateTimes = result.getLateTimes();
        resp.slack = result.getSlack();
        resp.dependencies = result.getDependencies();
        resp.workload = result.getWorkload();

        resp.tasks = new ArrayList<>();
        Set<Long> critical = new HashSet<>(result.getCriticalPath());
        Set<Long> released = new HashSet<>(result.getReleasedAssignments());
        for (Task t : tasks) {
            ScheduleResponse.TaskResult r = new ScheduleResponse.TaskResult();
            r.taskId = t.getId();
            r.name = t.getName();
            r.parentId = t.getParentId();
            r.duration = t.getDuration();
            r.employeeId = released.contains(t.getId())
                    ? null
                    : result.getAssignments().getOrDefault(t.getId(), t.getEmployeeId());
            r.critical = critical.contains(t.getId());

            DateRange dates = t.getId() == null ? null : result.getTaskDates().get(t.getId());
            if (dates != null) {
                r.startDate = dates.getStart().toString();
                r.endDate = dates.getEnd().toString();
                r.durationCalendarDays = dates.calendarDays();
            }
            resp.tasks.add(r);
        }

        resp.warnings = new ArrayList<>();
        for (ScheduleWarning w : result.getWarnings()) {
            ScheduleResponse.WarningDto dto = new ScheduleResponse.WarningDto();
            dto.taskId = w.getTaskId();
            dto.code = w.getCode().name();
            dto.message = w.getMessage();
            resp.warnings.add(dto);
        }
        return resp;
    }
}
