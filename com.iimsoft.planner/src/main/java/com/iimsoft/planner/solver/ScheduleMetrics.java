package com.iimsoft.planner.solver;

import com.iimsoft.planner.domain.DateRange;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * 排程结果的工期统计（日历天，含首尾）。
 */
public final class ScheduleMetrics {

    private ScheduleMetrics() {
    }

    /** max(end) - min(start) + 1；没有任何日期时为 0 */
    public static int calendarDuration(Map<Long, DateRange> dates) {
        LocalDate min = null;
        LocalDate max = null;
        for (DateRange r : dates.values()) {
            if (min == null || r.getStart().isBefore(min)) {
                min = r.getStart();
            }
            if (max == null || r.getEnd().isAfter(max)) {
                max = r.getEnd();
            }
        }
        if (min == null) {
            return 0;
        }
        return (int) ChronoUnit.DAYS.between(min, max) + 1;
    }

    /** 从给定的项目开始日算到最晚结束日：(latestEnd - projectStart) + 1；没有日期时为 0 */
    public static int durationFrom(LocalDate projectStart, Map<Long, DateRange> dates) {
        LocalDate max = null;
        for (DateRange r : dates.values()) {
            if (max == null || r.getEnd().isAfter(max)) {
                max = r.getEnd();
            }
        }
        if (max == null || projectStart == null) {
            return 0;
        }
        return (int) ChronoUnit.DAYS.between(projectStart, max) + 1;
    }
}
