package com.optura.core.graph;

import com.optura.core.model.Task;
import com.optura.core.model.TaskDependency;
import com.optura.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphBuilderTest {

    private final GraphBuilder builder = new GraphBuilder(1.0);

    static Task task(long id, long projectId, String name, Double estimate) {
        return Task.newTask(projectId, name, "", null, null, null, estimate, false, 0, null, null)
                .withId(id);
    }

    static Task task(long id, String name, Double estimate) {
        return task(id, 1L, name, estimate);
    }

    static TaskDependency dep(long taskId, long dependsOn) {
        return new TaskDependency(taskId, dependsOn);
    }

    @Nested
    class Building {

        @Test
        @DisplayName("Nodes are ordered by ascending task id regardless of input order")
        void nodesSortedById() {
            var graph = builder.build(1L, List.of(task(30, "C", 1.0), task(10, "A", 1.0), task(20, "B", 1.0)), List.of());
            assertEquals(List.of(10L, 20L, 30L), graph.nodes().stream().map(DependencyGraph.Node::taskId).toList());
            assertEquals(1, graph.indexOf(20L));
            assertEquals(-1, graph.indexOf(99L));
        }

        @Test
        @DisplayName("Edges point from prerequisite to dependent")
        void edgeDirection() {
            var graph = builder.build(1L, List.of(task(1, "A", 1.0), task(2, "B", 1.0)), List.of(dep(2, 1)));
            assertEquals(List.of(1), graph.successors(0));
            assertEquals(List.of(0), graph.predecessors(1));
            assertEquals(0, graph.inDegree(0));
            assertEquals(1, graph.inDegree(1));
            assertEquals(1L, graph.edges().get(0).from());
            assertEquals(2L, graph.edges().get(0).to());
        }

        @Test
        @DisplayName("Duplicate edges collapse into one")
        void duplicateEdges() {
            var graph = builder.build(1L, List.of(task(1, "A", 1.0), task(2, "B", 1.0)),
                    List.of(dep(2, 1), dep(2, 1)));
            assertEquals(1, graph.edgeCount());
        }

        @Test
        @DisplayName("Missing or non-positive estimates use the default duration")
        void defaultDuration() {
            var custom = new GraphBuilder(2.5);
            var graph = custom.build(1L, List.of(task(1, "A", null), task(2, "B", 0.0), task(3, "C", 4.0)), List.of());
            assertEquals(2.5, graph.node(0).duration());
            assertEquals(2.5, graph.node(1).duration());
            assertEquals(4.0, graph.node(2).duration());
            assertNull(graph.node(0).estimateHours());
        }

        @Test
        @DisplayName("Rejects a non-positive default duration")
        void rejectsBadDefault() {
            assertThrows(IllegalArgumentException.class, () -> new GraphBuilder(0));
        }

        @Test
        @DisplayName("Task from another project is refused")
        void foreignTask() {
            assertThrows(ProjectScopeException.class,
                    () -> builder.build(1L, List.of(task(1, 2L, "A", 1.0)), List.of()));
        }

        @Test
        @DisplayName("Edge referencing a task outside the list is refused")
        void danglingEdge() {
            assertThrows(ProjectScopeException.class,
                    () -> builder.build(1L, List.of(task(1, "A", 1.0)), List.of(dep(1, 7))));
        }

        @Test
        @DisplayName("Node keeps status, approval flag and order of the task")
        void nodeAttributes() {
            Task t = Task.newTask(1L, "A", "", null, null, null, 1.0, true, 4, null, null)
                    .withId(1L).withStatus(TaskStatus.REVIEW);
            var node = builder.build(1L, List.of(t), List.of()).node(0);
            assertEquals(TaskStatus.REVIEW, node.status());
            assertTrue(node.requiresApproval());
            assertEquals(4, node.order());
        }
    }

    @Nested
    class TopologicalOrder {

        @Test
        @DisplayName("Diamond A->{B,C}->D orders prerequisites first")
        void diamond() {
            var graph = builder.build(1L,
                    List.of(task(1, "A", 1.0), task(2, "B", 1.0), task(3, "C", 1.0), task(4, "D", 1.0)),
                    List.of(dep(2, 1), dep(3, 1), dep(4, 2), dep(4, 3)));
            assertEquals(List.of(0, 1, 2, 3), graph.topologicalOrder().orElseThrow());
            assertTrue(graph.isAcyclic());
        }

        @Test
        @DisplayName("Cycle A->B->C->A has no topological order")
        void cycle() {
            var graph = builder.build(1L,
                    List.of(task(1, "A", 1.0), task(2, "B", 1.0), task(3, "C", 1.0)),
                    List.of(dep(2, 1), dep(3, 2), dep(1, 3)));
            assertTrue(graph.topologicalOrder().isEmpty());
            assertFalse(graph.isAcyclic());
        }

        @Test
        @DisplayName("Empty graph is acyclic")
        void empty() {
            var graph = builder.build(1L, List.of(), List.of());
            assertTrue(graph.isEmpty());
            assertEquals(List.of(), graph.topologicalOrder().orElseThrow());
        }
    }
}
