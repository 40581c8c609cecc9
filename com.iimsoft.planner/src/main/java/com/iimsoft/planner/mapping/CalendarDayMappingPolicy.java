package com.iimsoft.planner.mapping;

import com.iimsoft.planner.domain.DateRange;
import com.iimsoft.planner.domain.Task;

import java.time.LocalDate;

/**
 * 不考虑休息日：start = projectStart + k，end = start + duration - 1。
 */
public class CalendarDayMappingPolicy implements DateMappingPolicy {

    @Override
    public DateRange map(Task task, int earliestTime, LocalDate projectStart) {
        if (!task.hasValidDuration()) {
            return null;
        }
        LocalDate start = projectStart.plusDays(earliestTime);
        return DateRange.ofLength(start, task.getDuration());
    }

    @Override
    public DateRange shift(Task task, LocalDate notBefore) {
        if (!task.hasValidDuration()) {
            return null;
        }
        return DateRange.ofLength(notBefore, task.getDuration());
    }
}
