package com.iimsoft.planner.persistence;

import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.graph.DependencyValidator;
import com.iimsoft.planner.service.port.TaskSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 内存版任务存储，命令行入口和测试用。对外只给副本。
 */
public class InMemoryTaskSource implements TaskSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryTaskSource.class);

    private final Map<Long, Task> tasks = new LinkedHashMap<>();
    private final Map<Long, Long> projectByTask = new LinkedHashMap<>();

    public void save(Long projectId, Task task) {
        Objects.requireNonNull(task.getId(), "task.id");
        tasks.put(task.getId(), task.copy());
        projectByTask.put(task.getId(), projectId);
    }

    /**
     * 前置字段按存储格式写入（JSON 数组字符串或逗号分隔）。
     */
    public void savePredecessors(Long taskId, String encoded) {
        Task task = require(taskId);
        PredecessorCodec.applyTo(task, encoded);
    }

    public String loadPredecessors(Long taskId) {
        return PredecessorCodec.encode(require(taskId).getPredecessorIds());
    }

    /**
     * 新增依赖：taskId 依赖 predecessorId。会形成环时拒绝。
     *
     * @throws IllegalArgumentException 任务不存在或会形成环
     */
    public void addDependency(Long taskId, Long predecessorId) {
        Task task = require(taskId);
        require(predecessorId);

        Map<Long, Set<Long>> dependencies = new LinkedHashMap<>();
        for (Task t : tasks.values()) {
            dependencies.put(t.getId(), t.getPredecessorIds());
        }
        if (DependencyValidator.wouldCreateCycle(taskId, predecessorId, dependencies)) {
            throw new IllegalArgumentException("任务 " + taskId + " 依赖 " + predecessorId + " 会形成循环依赖");
        }
        task.getPredecessorIds().add(predecessorId);
    }

    @Override
    public List<Task> listTasks(Long projectId) {
        List<Task> out = new ArrayList<>();
        for (Task t : tasks.values()) {
            if (Objects.equals(projectByTask.get(t.getId()), projectId) && !t.isSubtask()) {
                out.add(t.copy());
            }
        }
        return out;
    }

    @Override
    public Task getTask(Long taskId) {
        Task t = tasks.get(taskId);
        return t == null ? null : t.copy();
    }

    @Override
    public List<Task> getSubtasks(Long parentId) {
        List<Task> out = new ArrayList<>();
        for (Task t : tasks.values()) {
            if (Objects.equals(t.getParentId(), parentId)) {
                out.add(t.copy());
            }
        }
        return out;
    }

    @Override
    public boolean updateTaskDates(Long taskId, LocalDate start, LocalDate end) {
        Task t = tasks.get(taskId);
        if (t == null) {
            LOGGER.warn("updateTaskDates: task {} not found", taskId);
            return false;
        }
        t.setStartDate(start);
        t.setEndDate(end);
        return true;
    }

    @Override
    public boolean assignPerson(Long taskId, Long personId) {
        Task t = tasks.get(taskId);
        if (t == null) {
            LOGGER.warn("assignPerson: task {} not found", taskId);
            return false;
        }
        t.setEmployeeId(personId);
        return true;
    }

    private Task require(Long taskId) {
        Task t = tasks.get(taskId);
        if (t == null) {
            throw new IllegalArgumentException("任务不存在: " + taskId);
        }
        return t;
    }
}
