package com.iimsoft.planner.persistence;

import com.iimsoft.planner.domain.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTaskSourceTest {

    private InMemoryTaskSource source;

    @BeforeEach
    void setUp() {
        source = new InMemoryTaskSource();
        Task group = new Task(1L, "Design", 3);
        group.setGroup(true);
        Task sub = new Task(2L, "Mockups", 3);
        sub.setParentId(1L);
        source.save(100L, group);
        source.save(100L, new Task(3L, "Build", 2));
        source.save(100L, sub);
        source.save(200L, new Task(4L, "Other project", 1));
    }

    @Test
    void listAllTasksPutsSubtasksAfterTheirGroup() {
        List<Long> ids = source.listAllTasks(100L).stream().map(Task::getId).collect(Collectors.toList());
        assertEquals(List.of(1L, 2L, 3L), ids);
        assertEquals(1, source.listTasks(200L).size());
    }

    @Test
    void addDependencyRejectsCycles() {
        source.addDependency(3L, 1L);
        assertEquals("[1]", source.loadPredecessors(3L));

        assertThrows(IllegalArgumentException.class, () -> source.addDependency(1L, 3L));
        assertThrows(IllegalArgumentException.class, () -> source.addDependency(3L, 3L));
        assertThrows(IllegalArgumentException.class, () -> source.addDependency(3L, 99L));
    }

    @Test
    void storedPredecessorsAreDecoded() {
        source.savePredecessors(3L, "\"1\", 4");
        assertTrue(source.getTask(3L).isPredecessorsMalformed());

        source.savePredecessors(3L, "[1, 4]");
        assertEquals("[1,4]", source.loadPredecessors(3L));
    }

    @Test
    void writesAreVisibleAndUnknownIdsFail() {
        assertTrue(source.updateTaskDates(3L, LocalDate.of(2025, 1, 6), LocalDate.of(2025, 1, 7)));
        assertTrue(source.assignPerson(3L, 9L));
        assertEquals(LocalDate.of(2025, 1, 7), source.getTask(3L).getEndDate());
        assertEquals(9L, source.getTask(3L).getEmployeeId());

        assertFalse(source.updateTaskDates(99L, LocalDate.of(2025, 1, 6), LocalDate.of(2025, 1, 7)));
        assertFalse(source.assignPerson(99L, 9L));
        assertNull(source.getTask(99L));
    }

    @Test
    void returnsCopies() {
        source.getTask(3L).setName("changed");
        assertEquals("Build", source.getTask(3L).getName());
    }
}
