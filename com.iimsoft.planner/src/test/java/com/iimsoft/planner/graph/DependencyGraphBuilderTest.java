package com.iimsoft.planner.graph;

import com.iimsoft.planner.domain.ScheduleWarning;
import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.domain.WarningCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphBuilderTest {

    private DependencyGraphBuilder builder;
    private List<ScheduleWarning> warnings;

    @BeforeEach
    void setUp() {
        builder = new DependencyGraphBuilder();
        warnings = new ArrayList<>();
    }

    @Test
    @DisplayName("源点/汇点 + 边权为进入任务的时长")
    void buildsSourceSinkAndWeightedEdges() {
        List<Task> tasks = List.of(
                new Task(10L, "A", 3),
                new Task(20L, "B", 2, List.of(10L)),
                new Task(30L, "C", 1, List.of(10L)));

        DependencyGraph graph = builder.build(tasks, warnings);

        assertEquals(1, graph.nodeOf(10L));
        assertEquals(2, graph.nodeOf(20L));
        assertEquals(3, graph.nodeOf(30L));
        assertEquals(4, graph.getSink());
        assertEquals(5, graph.nodeCount());

        assertEquals(List.of(new Edge(0, 1, 0)), graph.edgesFrom(DependencyGraph.SOURCE));
        assertEquals(List.of(new Edge(1, 2, 2), new Edge(1, 3, 1)), graph.edgesFrom(1));
        assertEquals(List.of(new Edge(2, 4, 0)), graph.edgesFrom(2));
        assertEquals(List.of(new Edge(3, 4, 0)), graph.edgesFrom(3));
        assertTrue(graph.edgesFrom(4).isEmpty());

        assertEquals(List.of(10L), graph.getDependencies().get(20L));
        assertNull(graph.taskAt(0));
        assertNull(graph.taskAt(4));
        assertTrue(warnings.isEmpty());
    }

    @Test
    void skipsTasksWithoutIdOrDuration() {
        Task noDuration = new Task(2L, "no duration", null);
        Task zero = new Task(3L, "zero", 0);
        List<Task> tasks = List.of(new Task(null, "no id", 1), noDuration, zero, new Task(4L, "ok", 2));

        DependencyGraph graph = builder.build(tasks, warnings);

        assertEquals(1, graph.nodeOf(4L));
        assertNull(graph.nodeOf(2L));
        assertNull(graph.nodeOf(3L));
        assertEquals(2, graph.getSink());
        assertEquals(3, warnings.size());
        assertTrue(warnings.stream().allMatch(w -> w.getCode() == WarningCode.TASK_SKIPPED));
    }

    @Test
    void duplicateIdKeepsFirst() {
        DependencyGraph graph = builder.build(List.of(new Task(1L, "A", 1), new Task(1L, "A again", 5)), warnings);
        assertEquals(1, graph.getNodeByTask().size());
        assertEquals(WarningCode.TASK_SKIPPED, warnings.get(0).getCode());
    }

    @Test
    @DisplayName("未知前置被忽略，没有剩余前置时从源点连边")
    void unknownPredecessorFallsBackToSource() {
        DependencyGraph graph = builder.build(List.of(new Task(1L, "A", 2, List.of(99L))), warnings);

        assertEquals(List.of(new Edge(0, 1, 0)), graph.edgesFrom(0));
        assertTrue(graph.getDependencies().get(1L).isEmpty());
        assertEquals(WarningCode.UNKNOWN_PREDECESSOR, warnings.get(0).getCode());
    }

    @Test
    void predecessorSkippedForMissingDurationIsUnknown() {
        List<Task> tasks = List.of(new Task(1L, "A", null), new Task(2L, "B", 2, List.of(1L)));
        DependencyGraph graph = builder.build(tasks, warnings);

        assertEquals(List.of(new Edge(0, 1, 0)), graph.edgesFrom(0));
        assertEquals(2, warnings.size());
    }

    @Test
    void malformedPredecessorsAreReported() {
        Task t = new Task(1L, "A", 1);
        t.setPredecessorsMalformed(true);
        builder.build(List.of(t), warnings);
        assertEquals(WarningCode.UNPARSEABLE_PREDECESSORS, warnings.get(0).getCode());
    }

    @Test
    void emptyInputGivesEmptyGraph() {
        assertTrue(builder.build(List.of(), warnings).isEmpty());
        assertTrue(builder.build(null, warnings).isEmpty());
        assertEquals(0, builder.build(List.of(), warnings).nodeCount());
    }

    @Test
    void doesNotMutateInput() {
        Task b = new Task(2L, "B", 2, List.of(1L, 99L));
        builder.build(List.of(new Task(1L, "A", 1), b), warnings);
        assertEquals(2, b.getPredecessorIds().size());
    }
}
