package com.iimsoft.planner.mapping;

import com.iimsoft.planner.domain.DateRange;
import com.iimsoft.planner.domain.ScheduleWarning;
import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.domain.WarningCode;
import com.iimsoft.planner.graph.DependencyGraph;
import com.iimsoft.planner.graph.DependencyGraphBuilder;
import com.iimsoft.planner.solver.LongestPathSolver;
import com.iimsoft.planner.solver.PathAnalysis;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CalendarMapperTest {

    private static final LocalDate MON = LocalDate.of(2025, 1, 6);

    @Test
    void mapsEveryGraphTaskFromItsEarlyTime() {
        List<Task> tasks = List.of(
                new Task(1L, "A", 3),
                new Task(2L, "B", 2, List.of(1L)),
                new Task(3L, "C", 1, List.of(1L)));
        List<ScheduleWarning> warnings = new ArrayList<>();
        DependencyGraph graph = new DependencyGraphBuilder().build(tasks, warnings);
        PathAnalysis analysis = new LongestPathSolver().solve(graph);

        Map<Long, DateRange> dates = new CalendarMapper(new CalendarDayMappingPolicy())
                .map(tasks, graph, analysis, MON, warnings);

        assertEquals(List.of(1L, 2L, 3L), new ArrayList<>(dates.keySet()));
        assertEquals(DateRange.of(MON, MON.plusDays(2)), dates.get(1L));
        assertEquals(DateRange.of(MON.plusDays(2), MON.plusDays(3)), dates.get(2L));
        assertEquals(DateRange.of(MON.plusDays(1), MON.plusDays(1)), dates.get(3L));
        assertTrue(warnings.isEmpty());
    }

    @Test
    void undeterminedTaskIsOmittedWithWarning() {
        List<Task> tasks = List.of(new Task(1L, "A", 1), new Task(2L, "B", 1), new Task(3L, "skipped", null));
        List<ScheduleWarning> warnings = new ArrayList<>();
        DependencyGraph graph = new DependencyGraphBuilder().build(tasks, warnings);
        PathAnalysis analysis = new LongestPathSolver().solve(graph);
        warnings.clear();

        DateMappingPolicy policy = new CalendarDayMappingPolicy() {
            @Override
            public DateRange map(Task task, int earliestTime, LocalDate projectStart) {
                return task.getId() == 2L ? null : super.map(task, earliestTime, projectStart);
            }
        };
        Map<Long, DateRange> dates = new CalendarMapper(policy).map(tasks, graph, analysis, MON, warnings);

        assertEquals(1, dates.size());
        assertFalse(dates.containsKey(2L));
        assertFalse(dates.containsKey(3L));
        assertEquals(1, warnings.size());
        assertEquals(2L, warnings.get(0).getTaskId());
        assertEquals(WarningCode.DATES_UNDETERMINED, warnings.get(0).getCode());
    }
}
