package com.iimsoft.planner.solver;

import com.iimsoft.planner.domain.DateRange;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CriticalChainTracerTest {

    private final CriticalChainTracer tracer = new CriticalChainTracer();

    private static DateRange range(int startDay, int endDay) {
        return DateRange.of(LocalDate.of(2025, 1, startDay), LocalDate.of(2025, 1, endDay));
    }

    @Test
    void followsLatestFinishingPredecessor() {
        Map<Long, DateRange> dates = new LinkedHashMap<>();
        dates.put(1L, range(6, 8));
        dates.put(2L, range(9, 10));
        dates.put(3L, range(9, 9));
        dates.put(4L, range(11, 12));
        Map<Long, List<Long>> deps = Map.of(
                1L, List.of(),
                2L, List.of(1L),
                3L, List.of(1L),
                4L, List.of(2L, 3L));

        assertEquals(List.of(1L, 2L, 4L), tracer.trace(dates, deps));
    }

    @Test
    void cyclicDependenciesTerminate() {
        Map<Long, DateRange> dates = new LinkedHashMap<>();
        dates.put(1L, range(6, 6));
        dates.put(2L, range(7, 7));
        Map<Long, List<Long>> deps = Map.of(1L, List.of(2L), 2L, List.of(1L));

        assertEquals(List.of(1L, 2L), tracer.trace(dates, deps));
    }

    @Test
    void emptyDates() {
        assertTrue(tracer.trace(Map.of(), Map.of()).isEmpty());
    }

    @Test
    void durationFromProjectStart() {
        Map<Long, DateRange> dates = Map.of(1L, range(8, 10), 2L, range(9, 12));
        assertEquals(7, ScheduleMetrics.durationFrom(LocalDate.of(2025, 1, 6), dates));
        assertEquals(5, ScheduleMetrics.calendarDuration(dates));
        assertEquals(0, ScheduleMetrics.durationFrom(LocalDate.of(2025, 1, 6), Map.of()));
        assertEquals(0, ScheduleMetrics.calendarDuration(Map.of()));
    }
}
