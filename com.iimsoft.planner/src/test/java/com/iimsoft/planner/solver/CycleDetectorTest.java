package com.iimsoft.planner.solver;

import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.graph.DependencyGraph;
import com.iimsoft.planner.graph.DependencyGraphBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CycleDetectorTest {

    private final CycleDetector detector = new CycleDetector();

    private static DependencyGraph graphOf(Task... tasks) {
        return new DependencyGraphBuilder().build(List.of(tasks), new ArrayList<>());
    }

    @Test
    void twoTaskCycle() {
        DependencyGraph graph = graphOf(
                new Task(1L, "A", 1, List.of(2L)),
                new Task(2L, "B", 1, List.of(1L)));

        List<Integer> cycle = detector.findCycle(graph);
        assertTrue(detector.hasCycle(graph));
        assertEquals(2, cycle.size());
        assertTrue(cycle.containsAll(List.of(1, 2)));
    }

    @Test
    void cycleBehindAcyclicPrefix() {
        DependencyGraph graph = graphOf(
                new Task(1L, "A", 1),
                new Task(2L, "B", 1, List.of(1L, 4L)),
                new Task(3L, "C", 1, List.of(2L)),
                new Task(4L, "D", 1, List.of(3L)));

        List<Integer> cycle = detector.findCycle(graph);
        assertEquals(List.of(2, 3, 4), cycle);
    }

    @Test
    void acyclicGraph() {
        DependencyGraph graph = graphOf(
                new Task(1L, "A", 1),
                new Task(2L, "B", 1, List.of(1L)),
                new Task(3L, "C", 1, List.of(1L, 2L)));
        assertFalse(detector.hasCycle(graph));
        assertFalse(detector.hasCycle(DependencyGraph.empty()));
    }
}
