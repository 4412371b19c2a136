package com.optura.core.scheduler;

import com.optura.core.model.PriorityChange;
import com.optura.core.model.Task;
import com.optura.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PrioritizerTest {

    private Prioritizer prioritizer;

    @BeforeEach
    void setUp() {
        prioritizer = new Prioritizer();
    }

    private Task task(long id, TaskStatus status, int order) {
        return Task.newTask(1L, "T" + id, "", null, null, null, 1.0, false, order, null, null)
                .withId(id).withStatus(status);
    }

    private static List<Task> apply(List<Task> tasks, List<PriorityChange> changes) {
        var result = new ArrayList<Task>();
        for (Task t : tasks) {
            Task moved = t;
            for (PriorityChange c : changes) {
                if (c.taskId() == t.id()) {
                    moved = t.withOrder(c.newOrder());
                }
            }
            result.add(moved);
        }
        return result;
    }

    @Test
    @DisplayName("In-progress work moves ahead of pending work")
    void inProgressFirst() {
        var tasks = List.of(task(1, TaskStatus.PENDING, 0), task(2, TaskStatus.IN_PROGRESS, 1));

        var changes = prioritizer.reprioritize(tasks);

        assertEquals(List.of(
                new PriorityChange(2, "T2", 1, 0),
                new PriorityChange(1, "T1", 0, 1)), changes);
    }

    @Test
    @DisplayName("Full rank order: in progress, review, approved, pending, blocked, completed, failed")
    void fullRanking() {
        var tasks = List.of(
                task(1, TaskStatus.FAILED, 0),
                task(2, TaskStatus.COMPLETED, 1),
                task(3, TaskStatus.BLOCKED, 2),
                task(4, TaskStatus.PENDING, 3),
                task(5, TaskStatus.APPROVED, 4),
                task(6, TaskStatus.REVIEW, 5),
                task(7, TaskStatus.IN_PROGRESS, 6));

        var reordered = apply(tasks, prioritizer.reprioritize(tasks));
        reordered.sort((a, b) -> Integer.compare(a.order(), b.order()));

        assertEquals(List.of(7L, 6L, 5L, 4L, 3L, 2L, 1L), reordered.stream().map(Task::id).toList());
    }

    @Test
    @DisplayName("Equal ranks keep their previous relative order")
    void stableWithinRank() {
        var tasks = List.of(
                task(1, TaskStatus.PENDING, 2),
                task(2, TaskStatus.PENDING, 0),
                task(3, TaskStatus.REVIEW, 1));

        var reordered = apply(tasks, prioritizer.reprioritize(tasks));
        reordered.sort((a, b) -> Integer.compare(a.order(), b.order()));

        assertEquals(List.of(3L, 2L, 1L), reordered.stream().map(Task::id).toList());
    }

    @Test
    @DisplayName("Running twice yields no changes the second time")
    void idempotent() {
        var tasks = List.of(
                task(1, TaskStatus.COMPLETED, 0),
                task(2, TaskStatus.PENDING, 1),
                task(3, TaskStatus.IN_PROGRESS, 2),
                task(4, TaskStatus.REVIEW, 2));

        var once = apply(tasks, prioritizer.reprioritize(tasks));

        assertTrue(prioritizer.reprioritize(once).isEmpty());
    }

    @Test
    @DisplayName("Already ordered tasks produce no changes")
    void alreadyOrdered() {
        var tasks = List.of(task(1, TaskStatus.IN_PROGRESS, 0), task(2, TaskStatus.PENDING, 1));
        assertTrue(prioritizer.reprioritize(tasks).isEmpty());
    }

    @Test
    @DisplayName("Every status has a distinct rank")
    void ranksDistinct() {
        long distinct = Arrays.stream(TaskStatus.values()).mapToInt(Prioritizer::rank).distinct().count();
        assertEquals(TaskStatus.values().length, distinct);
    }
}
