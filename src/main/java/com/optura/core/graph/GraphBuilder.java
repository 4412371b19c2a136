package com.optura.core.graph;

import com.optura.core.model.Task;
import com.optura.core.model.TaskDependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assembles a {@link DependencyGraph} from the task and dependency records of one project.
 * <p>
 * Edges point from the prerequisite ({@code dependsOnTaskId}) to the dependent
 * ({@code taskId}). Duplicate edges collapse into one. Tasks without a positive
 * estimate get the default duration this builder was configured with.
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final double defaultDurationHours;

    public GraphBuilder(double defaultDurationHours) {
        if (defaultDurationHours <= 0) {
            throw new IllegalArgumentException("defaultDurationHours must be positive, got " + defaultDurationHours);
        }
        this.defaultDurationHours = defaultDurationHours;
    }

    public double defaultDurationHours() {
        return defaultDurationHours;
    }

    /**
     * Build the graph for {@code projectId}.
     *
     * @throws ProjectScopeException if a task belongs to another project, or an edge
     *                               references a task outside the supplied task list
     */
    public DependencyGraph build(long projectId, List<Task> tasks, List<TaskDependency> dependencies) {
        var sorted = new ArrayList<>(tasks);
        sorted.sort(Comparator.comparing(Task::id));

        var nodes = new ArrayList<DependencyGraph.Node>(sorted.size());
        var indexById = new HashMap<Long, Integer>();
        for (Task task : sorted) {
            if (task.projectId() != projectId) {
                throw new ProjectScopeException("Task " + task.id() + " belongs to project "
                        + task.projectId() + ", not " + projectId);
            }
            indexById.put(task.id(), nodes.size());
            nodes.add(new DependencyGraph.Node(task.id(), task.name(), durationOf(task),
                    task.estimateHours(), task.status(), task.requiresApproval(), task.order()));
        }

        List<List<Integer>> successors = new ArrayList<>(nodes.size());
        List<List<Integer>> predecessors = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            successors.add(new ArrayList<>());
            predecessors.add(new ArrayList<>());
        }

        Set<TaskDependency> seen = new HashSet<>();
        for (TaskDependency dep : dependencies) {
            if (!seen.add(dep)) {
                continue;
            }
            Integer from = indexById.get(dep.dependsOnTaskId());
            Integer to = indexById.get(dep.taskId());
            if (from == null || to == null) {
                throw new ProjectScopeException("Dependency " + dep.taskId() + " -> " + dep.dependsOnTaskId()
                        + " references a task outside project " + projectId);
            }
            successors.get(from).add(to);
            predecessors.get(to).add(from);
        }
        successors.forEach(list -> list.sort(Comparator.naturalOrder()));
        predecessors.forEach(list -> list.sort(Comparator.naturalOrder()));

        log.debug("Built graph for project {}: {} nodes, {} edges", projectId, nodes.size(), seen.size());
        return new DependencyGraph(projectId, nodes, indexById, successors, predecessors);
    }

    private double durationOf(Task task) {
        Double estimate = task.estimateHours();
        return estimate != null && estimate > 0 ? estimate : defaultDurationHours;
    }
}
