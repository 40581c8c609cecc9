package com.iimsoft.planner.domain;

public enum WarningCode {
    /** 缺 id 或 duration，未进入依赖图 */
    TASK_SKIPPED,
    UNPARSEABLE_PREDECESSORS,
    /** 前置任务 id 不在本次排程的任务里 */
    UNKNOWN_PREDECESSOR,
    /** 休息日配置导致在迭代上限内排不出日期 */
    DATES_UNDETERMINED,
    NO_ELIGIBLE_PERSON,
    NO_AVAILABLE_WINDOW,
    ASSIGNEE_UNAVAILABLE,
    PERSON_NOT_FOUND
}
