package com.iimsoft.planner.service;

import com.iimsoft.planner.domain.DateRange;
import com.iimsoft.planner.domain.Project;
import com.iimsoft.planner.domain.ScheduleResult;
import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.service.port.PersonDirectory;
import com.iimsoft.planner.service.port.ProjectSource;
import com.iimsoft.planner.service.port.TaskSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 从存储读项目和任务，排程后把日期和人员写回。
 *
 * 先算完整个结果再统一写，不会出现写了一半的排程。
 */
public class ScheduleService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScheduleService.class);

    private final ProjectSource projectSource;
    private final TaskSource taskSource;
    // 可为 null：不考虑休息日，不分配人员
    private final PersonDirectory personDirectory;
    private final ScheduleOrchestrator orchestrator;

    public ScheduleService(ProjectSource projectSource, TaskSource taskSource, PersonDirectory personDirectory,
                           ScheduleOrchestrator orchestrator) {
        this.projectSource = Objects.requireNonNull(projectSource, "projectSource");
        this.taskSource = Objects.requireNonNull(taskSource, "taskSource");
        this.personDirectory = personDirectory;
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    }

    public ScheduleRun scheduleProject(Long projectId) {
        Project project = projectSource.getProject(projectId);
        if (project == null) {
            throw new IllegalArgumentException("项目不存在: " + projectId);
        }

        List<Task> tasks = taskSource.listAllTasks(projectId);
        ScheduleResult result = orchestrator.computeSchedule(project, tasks, personDirectory);
        if (!result.isSuccessful()) {
            LOGGER.error("{} not scheduled: {} ({})", project.getLabel(), result.getError().getTag(),
                    result.getErrorMessage());
            return new ScheduleRun(result, 0, 0, 0);
        }

        Map<Long, Long> currentAssignee = new HashMap<>();
        for (Task t : tasks) {
            if (t.getId() != null && t.getEmployeeId() != null) {
                currentAssignee.put(t.getId(), t.getEmployeeId());
            }
        }

        int datesWritten = 0;
        int assignmentsWritten = 0;
        int failures = 0;
        for (Map.Entry<Long, DateRange> e : result.getTaskDates().entrySet()) {
            DateRange r = e.getValue();
            if (taskSource.updateTaskDates(e.getKey(), r.getStart(), r.getEnd())) {
                datesWritten++;
            } else {
                failures++;
                LOGGER.error("Failed to write dates {} for task {}", r, e.getKey());
            }
        }
        for (Map.Entry<Long, Long> e : result.getAssignments().entrySet()) {
            if (e.getValue().equals(currentAssignee.get(e.getKey()))) {
                continue;
            }
            if (taskSource.assignPerson(e.getKey(), e.getValue())) {
                assignmentsWritten++;
            } else {
                failures++;
                LOGGER.error("Failed to assign person {} to task {}", e.getValue(), e.getKey());
            }
        }

        for (Long taskId : result.getReleasedAssignments()) {
            if (taskSource.assignPerson(taskId, null)) {
                assignmentsWritten++;
            } else {
                failures++;
                LOGGER.error("Failed to clear the assignee of task {}", taskId);
            }
        }

        LOGGER.info("{}: wrote {} date ranges, {} assignments, {} failures",
                project.getLabel(), datesWritten, assignmentsWritten, failures);
        return new ScheduleRun(result, datesWritten, assignmentsWritten, failures);
    }
}
