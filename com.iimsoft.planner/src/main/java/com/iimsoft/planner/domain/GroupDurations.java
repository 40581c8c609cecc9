package com.iimsoft.planner.domain;

import java.util.List;

/**
 * 组任务时长 = 子任务时长的 max（存在并行子任务）或 sum（全部顺序）。
 * 这个不变式由调用方维护，排程本身不会自动改组任务的 duration。
 */
public final class GroupDurations {

    private GroupDurations() {
    }

    public static int derive(List<Task> subtasks) {
        if (subtasks == null || subtasks.isEmpty()) {
            return 0;
        }
        boolean anyParallel = subtasks.stream().anyMatch(Task::isParallel);
        int max = 0;
        int sum = 0;
        for (Task st : subtasks) {
            int d = st.hasValidDuration() ? st.getDuration() : 0;
            max = Math.max(max, d);
            sum += d;
        }
        return anyParallel ? max : sum;
    }

    /** 按子任务重算组任务时长并写回，返回新时长 */
    public static int recompute(Task group, List<Task> subtasks) {
        int d = derive(subtasks);
        group.setDuration(d);
        return d;
    }
}
