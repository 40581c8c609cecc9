package com.iimsoft.planner.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GroupDurationsTest {

    private static Task sub(int duration, boolean parallel) {
        Task t = new Task(null, null, duration);
        t.setParallel(parallel);
        return t;
    }

    @Test
    void sequentialSubtasksAreSummed() {
        assertEquals(5, GroupDurations.derive(List.of(sub(2, false), sub(3, false))));
    }

    @Test
    void anyParallelSubtaskMeansMax() {
        assertEquals(3, GroupDurations.derive(List.of(sub(2, true), sub(3, false))));
    }

    @Test
    void recomputeWritesBack() {
        Task group = new Task(1L, "G", 99);
        group.setGroup(true);
        assertEquals(4, GroupDurations.recompute(group, List.of(sub(1, false), sub(3, false))));
        assertEquals(4, group.getDuration());
        assertEquals(0, GroupDurations.derive(List.of()));
    }
}
