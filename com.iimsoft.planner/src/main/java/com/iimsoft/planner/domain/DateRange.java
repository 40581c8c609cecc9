package com.iimsoft.planner.domain;

import lombok.EqualsAndHashCode;

import java.time.LocalDate;

/**
 * 含首尾的日期区间 [start, end]。
 */
@EqualsAndHashCode
public final class DateRange {

    private final LocalDate start;
    private final LocalDate end;

    public DateRange(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start/end 不能为空");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Invalid date range: " + start + ".." + end);
        }
        this.start = start;
        this.end = end;
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    /** start 起连续 days 个日历天 */
    public static DateRange ofLength(LocalDate start, int days) {
        return new DateRange(start, start.plusDays(Math.max(days, 1) - 1L));
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return end;
    }

    public int calendarDays() {
        return (int) (end.toEpochDay() - start.toEpochDay()) + 1;
    }

    /** 保持日历跨度不变，整体挪到 newStart */
    public DateRange shiftTo(LocalDate newStart) {
        return ofLength(newStart, calendarDays());
    }

    public boolean overlaps(LocalDate from, LocalDate to) {
        return !end.isBefore(from) && !start.isAfter(to);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
