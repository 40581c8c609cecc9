package com.iimsoft.planner.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DependencyValidatorTest {

    // B 依赖 A，C 依赖 B
    private final Map<Long, List<Long>> deps = Map.of(
            1L, List.of(),
            2L, List.of(1L),
            3L, List.of(2L));

    @Test
    void selfDependencyIsACycle() {
        assertTrue(DependencyValidator.wouldCreateCycle(1L, 1L, deps));
    }

    @Test
    void transitiveBackEdgeIsACycle() {
        assertTrue(DependencyValidator.wouldCreateCycle(1L, 3L, deps));
        assertTrue(DependencyValidator.wouldCreateCycle(2L, 3L, deps));
    }

    @Test
    void forwardEdgeIsFine() {
        assertFalse(DependencyValidator.wouldCreateCycle(3L, 1L, deps));
        assertFalse(DependencyValidator.wouldCreateCycle(4L, 3L, deps));
        assertFalse(DependencyValidator.wouldCreateCycle(null, 3L, deps));
    }
}
