package com.optura.core.graph;

import com.optura.core.model.GraphEdgeView;
import com.optura.core.model.TaskStatus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, per-request dependency graph of one project.
 * <p>
 * Nodes live in an arena ordered by ascending task id; edges are adjacency
 * lists of arena indices pointing from a prerequisite to its dependent.
 * Built by {@link GraphBuilder} and discarded at the end of the request.
 */
public final class DependencyGraph {

    /**
     * Scheduling view of a task.
     *
     * @param duration      effective duration (estimate, or the configured default)
     * @param estimateHours raw estimate as stored, possibly {@code null}
     */
    public record Node(
        long taskId,
        String name,
        double duration,
        Double estimateHours,
        TaskStatus status,
        boolean requiresApproval,
        int order
    ) {}

    private final long projectId;
    private final List<Node> nodes;
    private final Map<Long, Integer> indexById;
    private final List<List<Integer>> successors;
    private final List<List<Integer>> predecessors;
    private final int edgeCount;

    DependencyGraph(long projectId, List<Node> nodes, Map<Long, Integer> indexById,
                    List<List<Integer>> successors, List<List<Integer>> predecessors) {
        this.projectId = projectId;
        this.nodes = List.copyOf(nodes);
        this.indexById = Map.copyOf(indexById);
        this.successors = successors.stream().map(List::copyOf).toList();
        this.predecessors = predecessors.stream().map(List::copyOf).toList();
        this.edgeCount = successors.stream().mapToInt(List::size).sum();
    }

    public long projectId() {
        return projectId;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public Node node(int index) {
        return nodes.get(index);
    }

    public List<Node> nodes() {
        return nodes;
    }

    /** Arena index of a task, or -1 when the task is not part of this graph. */
    public int indexOf(long taskId) {
        Integer index = indexById.get(taskId);
        return index != null ? index : -1;
    }

    /** Dependents of the node, in ascending task id order. */
    public List<Integer> successors(int index) {
        return successors.get(index);
    }

    /** Prerequisites of the node, in ascending task id order. */
    public List<Integer> predecessors(int index) {
        return predecessors.get(index);
    }

    public int inDegree(int index) {
        return predecessors.get(index).size();
    }

    public int outDegree(int index) {
        return successors.get(index).size();
    }

    public List<GraphEdgeView> edges() {
        var edges = new ArrayList<GraphEdgeView>(edgeCount);
        for (int from = 0; from < nodes.size(); from++) {
            for (int to : successors.get(from)) {
                edges.add(new GraphEdgeView(nodes.get(from).taskId(), nodes.get(to).taskId()));
            }
        }
        return edges;
    }

    /**
     * Kahn's algorithm over the arena. Nodes that become ready at the same time
     * are emitted in ascending task id order.
     *
     * @return the topological order of arena indices, or empty if the graph has a cycle
     */
    public Optional<List<Integer>> topologicalOrder() {
        int[] remaining = new int[nodes.size()];
        var queue = new ArrayDeque<Integer>();
        for (int i = 0; i < nodes.size(); i++) {
            remaining[i] = inDegree(i);
            if (remaining[i] == 0) {
                queue.addLast(i);
            }
        }

        var order = new ArrayList<Integer>(nodes.size());
        while (!queue.isEmpty()) {
            int current = queue.removeFirst();
            order.add(current);
            for (int next : successors.get(current)) {
                if (--remaining[next] == 0) {
                    queue.addLast(next);
                }
            }
        }

        if (order.size() < nodes.size()) {
            return Optional.empty();
        }
        return Optional.of(Collections.unmodifiableList(order));
    }

    public boolean isAcyclic() {
        return topologicalOrder().isPresent();
    }
}
