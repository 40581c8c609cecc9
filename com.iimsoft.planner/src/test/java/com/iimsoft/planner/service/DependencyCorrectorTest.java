package com.iimsoft.planner.service;

import com.iimsoft.planner.calendar.WorkCalendar;
import com.iimsoft.planner.calendar.WorkCalendarConfig;
import com.iimsoft.planner.domain.DateRange;
import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.mapping.WorkingDayMappingPolicy;
import com.iimsoft.planner.persistence.InMemoryPersonDirectory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DependencyCorrectorTest {

    private final DependencyCorrector corrector = new DependencyCorrector();

    private static DateRange jan(int startDay, int endDay) {
        return DateRange.of(LocalDate.of(2025, 1, startDay), LocalDate.of(2025, 1, endDay));
    }

    private static void assertOrdered(Map<Long, DateRange> dates, Map<Long, List<Long>> deps) {
        for (Map.Entry<Long, List<Long>> e : deps.entrySet()) {
            DateRange task = dates.get(e.getKey());
            for (Long pred : e.getValue()) {
                DateRange p = dates.get(pred);
                if (task != null && p != null) {
                    assertTrue(task.getStart().isAfter(p.getEnd()),
                            "task " + e.getKey() + " " + task + " must start after " + pred + " " + p);
                }
            }
        }
    }

    @Test
    void shiftsSuccessorPastPredecessorEnd() {
        Map<Long, DateRange> dates = new LinkedHashMap<>();
        dates.put(1L, jan(6, 8));
        dates.put(2L, jan(8, 9));
        dates.put(3L, jan(7, 7));
        Map<Long, List<Long>> deps = Map.of(1L, List.of(), 2L, List.of(1L), 3L, List.of(1L));

        Map<Long, DateRange> corrected = corrector.correct(dates, deps);

        assertEquals(jan(6, 8), corrected.get(1L));
        assertEquals(jan(9, 10), corrected.get(2L));
        assertEquals(jan(9, 9), corrected.get(3L));
        // 输入不变
        assertEquals(jan(8, 9), dates.get(2L));
    }

    @Test
    @DisplayName("已经一致的日期校正两次不变")
    void idempotent() {
        Map<Long, DateRange> dates = new LinkedHashMap<>();
        dates.put(1L, jan(6, 8));
        dates.put(2L, jan(9, 10));
        dates.put(3L, jan(13, 13));
        Map<Long, List<Long>> deps = Map.of(1L, List.of(), 2L, List.of(1L), 3L, List.of(1L, 2L));

        Map<Long, DateRange> once = corrector.correct(dates, deps);
        Map<Long, DateRange> twice = corrector.correct(once, deps);

        assertEquals(dates, once);
        assertEquals(once, twice);
    }

    @Test
    @DisplayName("前置推迟后，所有传递后继都排在前置之后")
    void cascadesToTransitiveSuccessors() {
        Map<Long, DateRange> dates = new LinkedHashMap<>();
        dates.put(1L, jan(6, 10));
        dates.put(2L, jan(8, 9));
        dates.put(3L, jan(10, 10));
        dates.put(4L, jan(11, 14));
        Map<Long, List<Long>> deps = Map.of(
                1L, List.of(),
                2L, List.of(1L),
                3L, List.of(2L),
                4L, List.of(3L, 1L));

        Map<Long, DateRange> corrected = corrector.correct(dates, deps);

        assertEquals(jan(11, 12), corrected.get(2L));
        assertEquals(jan(13, 13), corrected.get(3L));
        assertEquals(jan(14, 17), corrected.get(4L));
        assertOrdered(corrected, deps);
    }

    @Test
    void predecessorListedLaterInInputIsHandled() {
        Map<Long, DateRange> dates = new LinkedHashMap<>();
        dates.put(3L, jan(6, 6));
        dates.put(2L, jan(6, 7));
        dates.put(1L, jan(6, 8));
        Map<Long, List<Long>> deps = Map.of(3L, List.of(2L), 2L, List.of(1L), 1L, List.of());

        Map<Long, DateRange> corrected = corrector.correct(dates, deps);

        assertEquals(jan(9, 10), corrected.get(2L));
        assertEquals(jan(11, 11), corrected.get(3L));
        assertEquals(List.of(3L, 2L, 1L), List.copyOf(corrected.keySet()));
    }

    @Test
    void undatedPredecessorIsIgnored() {
        Map<Long, DateRange> dates = new LinkedHashMap<>();
        dates.put(2L, jan(6, 7));
        Map<Long, List<Long>> deps = Map.of(1L, List.of(), 2L, List.of(1L));

        assertEquals(jan(6, 7), corrector.correct(dates, deps).get(2L));
    }

    @Test
    @DisplayName("环上的任务追加在拓扑序后面，校正仍然会结束")
    void leftoverCycleTerminates() {
        Map<Long, DateRange> dates = new LinkedHashMap<>();
        dates.put(1L, jan(6, 6));
        dates.put(2L, jan(6, 6));
        dates.put(3L, jan(6, 6));
        Map<Long, List<Long>> deps = new LinkedHashMap<>();
        deps.put(1L, List.of(2L));
        deps.put(2L, List.of(1L));
        deps.put(3L, List.of());

        Map<Long, DateRange> corrected = corrector.correct(dates, deps);

        assertEquals(3, corrected.size());
        assertEquals(jan(6, 6), corrected.get(3L));
    }

    @Test
    @DisplayName("跳休息日：挪动后按 duration 重新数工作日，不沿用跨周末的日历跨度")
    void workingDayShiftKeepsDuration() {
        DependencyCorrector workingDays = new DependencyCorrector(
                new WorkingDayMappingPolicy(new InMemoryPersonDirectory(), WorkCalendarConfig.defaults()));
        Map<Long, DateRange> dates = new LinkedHashMap<>();
        dates.put(1L, jan(6, 13));
        dates.put(2L, jan(10, 13));
        Map<Long, List<Long>> deps = Map.of(1L, List.of(), 2L, List.of(1L));
        Map<Long, Task> tasks = Map.of(1L, new Task(1L, "Y", 6), 2L, new Task(2L, "B", 2, List.of(1L)));

        Map<Long, DateRange> corrected = workingDays.correct(dates, deps, tasks);

        assertEquals(jan(14, 15), corrected.get(2L));
        assertEquals(2, WorkCalendar.of(List.of(6, 7)).countWorkingDays(jan(14, 15).getStart(), jan(14, 15).getEnd()));
    }

    @Test
    @DisplayName("前置在周五结束：后继从下周一开始")
    void workingDayShiftSkipsToNextWorkingDay() {
        DependencyCorrector workingDays = new DependencyCorrector(
                new WorkingDayMappingPolicy(new InMemoryPersonDirectory(), WorkCalendarConfig.defaults()));
        Map<Long, DateRange> dates = new LinkedHashMap<>();
        dates.put(1L, jan(8, 10));
        dates.put(2L, jan(9, 10));
        Map<Long, List<Long>> deps = Map.of(1L, List.of(), 2L, List.of(1L));
        Map<Long, Task> tasks = Map.of(1L, new Task(1L, "A", 3), 2L, new Task(2L, "B", 2, List.of(1L)));

        assertEquals(jan(13, 14), workingDays.correct(dates, deps, tasks).get(2L));
    }

    @Test
    void calendarDayShiftUsesTaskDuration() {
        Map<Long, DateRange> dates = new LinkedHashMap<>();
        dates.put(1L, jan(6, 8));
        dates.put(2L, jan(7, 10));
        Map<Long, List<Long>> deps = Map.of(1L, List.of(), 2L, List.of(1L));
        Map<Long, Task> tasks = Map.of(2L, new Task(2L, "B", 2, List.of(1L)));

        assertEquals(jan(9, 10), corrector.correct(dates, deps, tasks).get(2L));
    }

    @Test
    void emptyInput() {
        assertTrue(corrector.correct(Map.of(), Map.of()).isEmpty());
    }
}
