package com.iimsoft.planner.domain;

/**
 * 结构性错误，出现时本次排程终止，结果里只带错误标记。
 */
public enum ScheduleError {
    CYCLIC_DEPENDENCY("cyclic dependency"),
    RELAXATION_LIMIT_EXCEEDED("relaxation limit exceeded");

    private final String tag;

    ScheduleError(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
