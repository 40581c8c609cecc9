package com.iimsoft.planner.solver;

import java.util.List;

public class CyclicDependencyException extends RuntimeException {

    private final List<Long> taskIds;

    public CyclicDependencyException(List<Long> taskIds) {
        super("Cyclic dependency between tasks " + taskIds);
        this.taskIds = List.copyOf(taskIds);
    }

    /** 环上的任务 id（按依赖方向） */
    public List<Long> getTaskIds() {
        return taskIds;
    }
}
