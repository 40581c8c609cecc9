package com.iimsoft.planner.service;

import com.iimsoft.planner.domain.ScheduleResult;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 一次落库排程的结果：计算结果 + 写回统计。
 */
@Data
@AllArgsConstructor
public class ScheduleRun {
    ScheduleResult result;
    int datesWritten;
    int assignmentsWritten;
    // updateTaskDates / assignPerson 返回 false 的次数
    int writeFailures;
}
