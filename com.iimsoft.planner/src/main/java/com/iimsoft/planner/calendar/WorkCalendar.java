package com.iimsoft.planner.calendar;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 按周模式判断某一天是否工作日（1=周一 ... 7=周日）。
 *
 * 说明：
 * - 每个人一套固定的周休息日，这里统一抽象为一周 7 天哪些天不工作（BitSet）。
 * - 排程里所有“跳过休息日”的推算都走这个类，避免规则写散。
 * - 找不到结果的推算返回 null，由调用方决定是否告警。
 */
public final class WorkCalendar {

    private static final int DAYS_PER_WEEK = 7;

    /** bit 1..7 = 休息日 */
    private final BitSet daysOff;

    private WorkCalendar(BitSet daysOff) {
        this.daysOff = daysOff;
    }

    public static WorkCalendar of(Collection<Integer> daysOff) {
        BitSet bs = new BitSet(DAYS_PER_WEEK + 1);
        if (daysOff != null) {
            for (Integer d : daysOff) {
                if (d != null && d >= 1 && d <= DAYS_PER_WEEK) {
                    bs.set(d);
                }
            }
        }
        return new WorkCalendar(bs);
    }

    /** 没有休息日，每天都工作 */
    public static WorkCalendar allWorking() {
        return new WorkCalendar(new BitSet(DAYS_PER_WEEK + 1));
    }

    public static int isoWeekday(LocalDate date) {
        return date.getDayOfWeek().getValue();
    }

    public static LocalDate plusDays(LocalDate date, long days) {
        return date.plusDays(days);
    }

    public static LocalDate minusDays(LocalDate date, long days) {
        return date.minusDays(days);
    }

    /** 含首尾的日历天数 */
    public static int calendarDaysInclusive(LocalDate start, LocalDate end) {
        return (int) ChronoUnit.DAYS.between(start, end) + 1;
    }

    public boolean isWorkingDay(LocalDate date) {
        return !daysOff.get(isoWeekday(date));
    }

    public boolean hasWorkingDays() {
        return daysOff.cardinality() < DAYS_PER_WEEK;
    }

    public int workingDaysPerWeek() {
        return DAYS_PER_WEEK - daysOff.cardinality();
    }

    public Set<Integer> getDaysOff() {
        Set<Integer> out = new LinkedHashSet<>();
        for (int d = daysOff.nextSetBit(1); d >= 0; d = daysOff.nextSetBit(d + 1)) {
            out.add(d);
        }
        return out;
    }

    /**
     * 统计 [start, end] 内的工作日数，end 早于 start 时为 0。
     */
    public int countWorkingDays(LocalDate start, LocalDate end) {
        int count = 0;
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            if (isWorkingDay(d)) {
                count++;
            }
        }
        return count;
    }

    /**
     * 当天或之后的第一个工作日；整周都休息时返回 null。
     */
    public LocalDate nextWorkingDay(LocalDate from) {
        LocalDate d = from;
        for (int i = 0; i < DAYS_PER_WEEK; i++) {
            if (isWorkingDay(d)) {
                return d;
            }
            d = d.plusDays(1);
        }
        return null;
    }

    /**
     * 从工作日 workingStart 起，再往后跳过 workingDays 个工作日，返回落到的工作日。
     * workingDays=0 时返回 workingStart 本身。超过 maxIterations 个日历天仍未凑够时返回 null。
     */
    public LocalDate skipWorkingDays(LocalDate workingStart, int workingDays, int maxIterations) {
        LocalDate current = workingStart;
        int skipped = 0;
        int iterations = 0;
        while (skipped < workingDays) {
            if (iterations >= maxIterations) {
                return null;
            }
            current = current.plusDays(1);
            iterations++;
            if (isWorkingDay(current)) {
                skipped++;
            }
        }
        return current;
    }

    /**
     * 从 start 开始（start 记为第 1 个工作日）数满 duration 个工作日，返回最后一个工作日。
     * start 必须是工作日。超过 maxIterations 个日历天仍未数满时返回 null。
     */
    public LocalDate endOfWorkingSpan(LocalDate start, int duration, int maxIterations) {
        if (!isWorkingDay(start)) {
            return null;
        }
        return skipWorkingDays(start, Math.max(duration, 1) - 1, maxIterations);
    }

    /**
     * [start, end] 内每一天都是工作日。
     */
    public boolean isFullyWorking(LocalDate start, LocalDate end) {
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            if (!isWorkingDay(d)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 从 from 起向后找第一个连续 duration 个日历天都是工作日的窗口起点，
     * 候选起点最多尝试 horizonDays 个；找不到返回 null。
     */
    public LocalDate findContiguousWindow(LocalDate from, int duration, int horizonDays) {
        int length = Math.max(duration, 1);
        for (int offset = 0; offset < horizonDays; offset++) {
            LocalDate candidate = from.plusDays(offset);
            if (isFullyWorking(candidate, candidate.plusDays(length - 1L))) {
                return candidate;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "WorkCalendar{daysOff=" + getDaysOff() + "}";
    }
}
