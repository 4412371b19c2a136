package com.optura.core.scheduler;

import com.optura.core.graph.GraphBuilder;
import com.optura.core.model.BlockedTask;
import com.optura.core.model.NextActions;
import com.optura.core.model.Task;
import com.optura.core.model.TaskDependency;
import com.optura.core.model.TaskRef;
import com.optura.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReadinessClassifierTest {

    private ReadinessClassifier classifier;
    private GraphBuilder builder;

    @BeforeEach
    void setUp() {
        classifier = new ReadinessClassifier();
        builder = new GraphBuilder(1.0);
    }

    private Task task(long id, String name, TaskStatus status, boolean requiresApproval) {
        return Task.newTask(1L, name, "", null, null, null, 1.0, requiresApproval, 0, null, null)
                .withId(id).withStatus(status);
    }

    private Task task(long id, String name, TaskStatus status) {
        return task(id, name, status, false);
    }

    private NextActions classify(List<Task> tasks, List<TaskDependency> deps) {
        return classifier.classify(builder.build(1L, tasks, deps));
    }

    private static List<Long> ids(List<TaskRef> refs) {
        return refs.stream().map(TaskRef::taskId).toList();
    }

    @Test
    @DisplayName("Chain A->B->C: only A is actionable, each later task blocked by its prerequisite")
    void linearChain() {
        var result = classify(
                List.of(task(1, "A", TaskStatus.PENDING), task(2, "B", TaskStatus.PENDING), task(3, "C", TaskStatus.PENDING)),
                List.of(new TaskDependency(2, 1), new TaskDependency(3, 2)));

        assertEquals(List.of(1L), ids(result.actionable()));
        assertTrue(result.needsApproval().isEmpty());
        assertEquals(List.of(new BlockedTask(2, "B", List.of("A")), new BlockedTask(3, "C", List.of("B"))),
                result.blocked());
    }

    @Test
    @DisplayName("Completing A unblocks B")
    void completedPrerequisiteUnblocks() {
        var result = classify(
                List.of(task(1, "A", TaskStatus.COMPLETED), task(2, "B", TaskStatus.PENDING)),
                List.of(new TaskDependency(2, 1)));

        assertEquals(List.of(2L), ids(result.actionable()));
        assertTrue(result.blocked().isEmpty());
    }

    @Test
    @DisplayName("Approved but unfinished prerequisite still blocks")
    void approvedPrerequisiteBlocks() {
        var result = classify(
                List.of(task(1, "A", TaskStatus.APPROVED), task(2, "B", TaskStatus.PENDING)),
                List.of(new TaskDependency(2, 1)));

        assertEquals(List.of(1L), ids(result.actionable()));
        assertEquals(List.of("A"), result.blocked().get(0).blockedBy());
    }

    @Test
    @DisplayName("Ready REVIEW task requiring approval waits for sign-off")
    void reviewNeedsApproval() {
        var result = classify(
                List.of(task(1, "A", TaskStatus.REVIEW, true), task(2, "B", TaskStatus.REVIEW, false)),
                List.of());

        assertEquals(List.of(1L), ids(result.needsApproval()));
        assertEquals(List.of(2L), ids(result.actionable()));
    }

    @Test
    @DisplayName("Completed, failed and in-progress tasks are not offered")
    void closedTasksExcluded() {
        var result = classify(
                List.of(task(1, "A", TaskStatus.COMPLETED), task(2, "B", TaskStatus.FAILED),
                        task(3, "C", TaskStatus.IN_PROGRESS), task(4, "D", TaskStatus.BLOCKED)),
                List.of());

        assertEquals(List.of(4L), ids(result.actionable()));
        assertTrue(result.blocked().isEmpty());
    }

    @Test
    @DisplayName("Every open task lands in exactly one list")
    void partitionIsComplete() {
        var result = classify(
                List.of(task(1, "A", TaskStatus.PENDING), task(2, "B", TaskStatus.REVIEW, true),
                        task(3, "C", TaskStatus.PENDING), task(4, "D", TaskStatus.APPROVED)),
                List.of(new TaskDependency(3, 1), new TaskDependency(3, 2)));

        assertEquals(List.of(1L, 4L), ids(result.actionable()));
        assertEquals(List.of(2L), ids(result.needsApproval()));
        assertEquals(List.of("A", "B"), result.blocked().get(0).blockedBy());
        assertEquals(4, result.actionable().size() + result.needsApproval().size() + result.blocked().size());
    }

    @Test
    @DisplayName("Works on a cyclic graph: tasks on the cycle block each other")
    void cyclicGraph() {
        var result = classify(
                List.of(task(1, "A", TaskStatus.PENDING), task(2, "B", TaskStatus.PENDING)),
                List.of(new TaskDependency(2, 1), new TaskDependency(1, 2)));

        assertTrue(result.actionable().isEmpty());
        assertEquals(2, result.blocked().size());
    }
}
