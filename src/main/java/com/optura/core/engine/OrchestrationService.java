package com.optura.core.engine;

import com.optura.core.config.OrchestrationProperties;
import com.optura.core.events.EventBus;
import com.optura.core.events.OpturaEvent;
import com.optura.core.graph.CriticalPathAnalyzer;
import com.optura.core.graph.DependencyGraph;
import com.optura.core.graph.GraphBuilder;
import com.optura.core.logging.MdcContext;
import com.optura.core.metrics.OpturaMetrics;
import com.optura.core.model.CriticalPathResult;
import com.optura.core.model.DependencyGraphView;
import com.optura.core.model.GraphNodeView;
import com.optura.core.model.NextActions;
import com.optura.core.model.PriorityChange;
import com.optura.core.model.Project;
import com.optura.core.model.ReprioritizeResult;
import com.optura.core.model.StatusSummary;
import com.optura.core.model.Task;
import com.optura.core.model.TaskStatus;
import com.optura.core.scheduler.Prioritizer;
import com.optura.core.scheduler.ReadinessClassifier;
import com.optura.core.store.ProjectNotFoundException;
import com.optura.core.store.ProjectSnapshot;
import com.optura.core.store.StaleTaskException;
import com.optura.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Project-level orchestration queries and reprioritization.
 * <p>
 * Every call reads one snapshot of the project from the store, builds a fresh
 * {@link DependencyGraph} and drops it when the call returns.
 */
@Service
public class OrchestrationService {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationService.class);

    static final int SUMMARY_NEXT_ACTIONS = 3;

    private final TaskStore store;
    private final GraphBuilder graphBuilder;
    private final CriticalPathAnalyzer criticalPathAnalyzer;
    private final ReadinessClassifier readinessClassifier;
    private final Prioritizer prioritizer;
    private final EventBus eventBus;
    private final OpturaMetrics metrics;
    private final OrchestrationProperties properties;

    public OrchestrationService(TaskStore store,
                                GraphBuilder graphBuilder,
                                CriticalPathAnalyzer criticalPathAnalyzer,
                                ReadinessClassifier readinessClassifier,
                                Prioritizer prioritizer,
                                EventBus eventBus,
                                OpturaMetrics metrics,
                                OrchestrationProperties properties) {
        this.store = store;
        this.graphBuilder = graphBuilder;
        this.criticalPathAnalyzer = criticalPathAnalyzer;
        this.readinessClassifier = readinessClassifier;
        this.prioritizer = prioritizer;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    public CriticalPathResult criticalPath(long projectId) {
        MdcContext.setProject(projectId);
        MdcContext.setAction("critical_path");
        try {
            requireProject(projectId);
            return computeCriticalPath(buildGraph(projectId));
        } finally {
            MdcContext.clear();
        }
    }

    public DependencyGraphView dependencyGraph(long projectId) {
        MdcContext.setProject(projectId);
        MdcContext.setAction("dependency_graph");
        try {
            requireProject(projectId);
            DependencyGraph graph = buildGraph(projectId);
            List<GraphNodeView> nodes = graph.nodes().stream()
                    .map(n -> new GraphNodeView(n.taskId(), n.name(), n.status(), n.estimateHours(),
                            n.requiresApproval(), n.order()))
                    .toList();
            return new DependencyGraphView(projectId, nodes, graph.edges());
        } finally {
            MdcContext.clear();
        }
    }

    public NextActions nextActions(long projectId) {
        MdcContext.setProject(projectId);
        MdcContext.setAction("next_actions");
        try {
            requireProject(projectId);
            return readinessClassifier.classify(buildGraph(projectId));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Reorders the project's tasks by status priority and persists the moved ones.
     * Order is not gated, so a concurrently modified task is re-read and its new
     * order applied to the fresh copy. A task that keeps conflicting past the retry
     * limit keeps its old order; the result lists only the changes that were saved.
     */
    public ReprioritizeResult reprioritize(long projectId) {
        MdcContext.setProject(projectId);
        MdcContext.setAction("reprioritize");
        try {
            requireProject(projectId);
            List<Task> tasks = store.listTasks(projectId);
            List<PriorityChange> changes = new ArrayList<>();
            for (PriorityChange change : prioritizer.reprioritize(tasks)) {
                try {
                    if (saveOrder(change)) {
                        changes.add(change);
                    }
                } catch (TransitionConflictException e) {
                    log.warn("Giving up on new order {} for task {}: {}", change.newOrder(), change.taskId(),
                            e.getMessage());
                }
            }
            metrics.recordReprioritization(changes.size());
            if (!changes.isEmpty()) {
                eventBus.publish(OpturaEvent.of("tasks.reprioritized", projectId, null, "orchestrator_service",
                        Map.of("change_count", changes.size(), "changes", changes)));
            }
            return new ReprioritizeResult(projectId, changes, tasks.size());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Dashboard view: counts per status, estimate progress, critical path hours and
     * the first few actionable tasks.
     */
    public StatusSummary statusSummary(long projectId) {
        MdcContext.setProject(projectId);
        MdcContext.setAction("status_summary");
        try {
            Project project = requireProject(projectId);
            ProjectSnapshot snapshot = store.snapshot(projectId);
            DependencyGraph graph = graphBuilder.build(projectId, snapshot.tasks(), snapshot.dependencies());

            Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
            for (TaskStatus status : TaskStatus.values()) {
                counts.put(status, 0);
            }
            double totalEstimate = 0;
            double completedEstimate = 0;
            for (Task task : snapshot.tasks()) {
                counts.merge(task.status(), 1, Integer::sum);
                if (task.estimateHours() != null && task.estimateHours() > 0) {
                    totalEstimate += task.estimateHours();
                    if (task.status() == TaskStatus.COMPLETED) {
                        completedEstimate += task.estimateHours();
                    }
                }
            }
            double progress = totalEstimate > 0 ? completedEstimate / totalEstimate * 100 : 0;

            CriticalPathResult criticalPath = computeCriticalPath(graph);
            NextActions nextActions = readinessClassifier.classify(graph);

            return new StatusSummary(
                    projectId,
                    project.name(),
                    project.status(),
                    project.riskLevel(),
                    counts,
                    snapshot.tasks().size(),
                    totalEstimate,
                    completedEstimate,
                    Math.round(progress * 100.0) / 100.0,
                    criticalPath.totalHours(),
                    nextActions.actionable().stream().limit(SUMMARY_NEXT_ACTIONS).toList(),
                    nextActions.needsApproval(),
                    criticalPath.circularDependency());
        } finally {
            MdcContext.clear();
        }
    }

    private CriticalPathResult computeCriticalPath(DependencyGraph graph) {
        long start = System.currentTimeMillis();
        CriticalPathResult result = criticalPathAnalyzer.analyze(graph);
        metrics.recordCriticalPath(System.currentTimeMillis() - start, result.circularDependency());
        if (result.circularDependency()) {
            metrics.recordCycleDetected();
        }
        return result;
    }

    private DependencyGraph buildGraph(long projectId) {
        ProjectSnapshot snapshot = store.snapshot(projectId);
        return graphBuilder.build(projectId, snapshot.tasks(), snapshot.dependencies());
    }

    private Project requireProject(long projectId) {
        return store.findProject(projectId).orElseThrow(() -> new ProjectNotFoundException(projectId));
    }

    private boolean saveOrder(PriorityChange change) {
        int attempts = 0;
        while (true) {
            Optional<Task> current = store.findTask(change.taskId());
            if (current.isEmpty()) {
                log.info("Task {} disappeared during reprioritization, skipping", change.taskId());
                return false;
            }
            try {
                store.saveTask(current.get().withOrder(change.newOrder()));
                return true;
            } catch (StaleTaskException e) {
                if (++attempts > properties.getMaxConflictRetries()) {
                    throw new TransitionConflictException(change.taskId(), attempts, e);
                }
                log.debug("Order update for task {} hit a concurrent write, retrying ({}/{})",
                        change.taskId(), attempts, properties.getMaxConflictRetries());
            }
        }
    }
}
