package com.optura.core.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.optura.core.advisor.TaskAdvisor;
import com.optura.core.config.OrchestrationProperties;
import com.optura.core.events.EventBus;
import com.optura.core.events.OpturaEvent;
import com.optura.core.graph.GraphBuilder;
import com.optura.core.lifecycle.GateViolationException;
import com.optura.core.lifecycle.TaskLifecycle;
import com.optura.core.logging.MdcContext;
import com.optura.core.metrics.OpturaMetrics;
import com.optura.core.model.Task;
import com.optura.core.model.TaskDependency;
import com.optura.core.model.TaskSpecification;
import com.optura.core.model.TaskStatus;
import com.optura.core.model.TaskUpdate;
import com.optura.core.store.ProjectNotFoundException;
import com.optura.core.store.ProjectSnapshot;
import com.optura.core.store.StaleTaskException;
import com.optura.core.store.TaskNotFoundException;
import com.optura.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Task-level operations: CRUD, gated lifecycle transitions, dependency creation
 * and spec generation.
 * <p>
 * Writes are check-then-compare-and-set against the task version. When another
 * writer got there first the task is re-read and every gate evaluated again, up to
 * {@link OrchestrationProperties#getMaxConflictRetries()} times. Gate violations
 * are never retried.
 */
@Service
public class TaskActionService {

    private static final Logger log = LoggerFactory.getLogger(TaskActionService.class);

    private static final TypeReference<Map<String, Object>> SPEC_TYPE = new TypeReference<>() {};

    static final double DEFAULT_SPEC_CONFIDENCE = 0.5;

    private final TaskStore store;
    private final TaskLifecycle lifecycle;
    private final TaskAdvisor advisor;
    private final GraphBuilder graphBuilder;
    private final EventBus eventBus;
    private final OpturaMetrics metrics;
    private final OrchestrationProperties properties;
    private final ObjectMapper objectMapper;

    public TaskActionService(TaskStore store,
                             TaskLifecycle lifecycle,
                             TaskAdvisor advisor,
                             GraphBuilder graphBuilder,
                             EventBus eventBus,
                             OpturaMetrics metrics,
                             OrchestrationProperties properties,
                             ObjectMapper objectMapper) {
        this.store = store;
        this.lifecycle = lifecycle;
        this.advisor = advisor;
        this.graphBuilder = graphBuilder;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    // ── CRUD ────────────────────────────────────────────────────────────

    public Task createTask(Task draft) {
        if (store.findProject(draft.projectId()).isEmpty()) {
            throw new ProjectNotFoundException(draft.projectId());
        }
        Task created = store.saveTask(draft.withId(null));
        log.info("Created task {} '{}' in project {}", created.id(), created.name(), created.projectId());
        eventBus.publish(OpturaEvent.of("task.created", created.projectId(), created.id(), "system",
                Map.of("name", String.valueOf(created.name()))));
        return created;
    }

    public Task getTask(long taskId) {
        return requireTask(taskId);
    }

    public List<Task> listTasks(long projectId) {
        if (store.findProject(projectId).isEmpty()) {
            throw new ProjectNotFoundException(projectId);
        }
        return store.listTasks(projectId);
    }

    /**
     * Partial update. APPROVED and COMPLETED are only reachable through
     * {@link #approve} and {@link #complete}, where the gates run.
     *
     * @throws IllegalArgumentException when the update targets a gated status
     */
    public Task updateTask(long taskId, TaskUpdate update) {
        if (update.status() == TaskStatus.APPROVED || update.status() == TaskStatus.COMPLETED) {
            throw new IllegalArgumentException("Status " + update.status()
                    + " can only be set through the " + (update.status() == TaskStatus.APPROVED ? "approve" : "complete")
                    + " action");
        }
        return transition(taskId, "update", "system", update::applyTo, Map.of());
    }

    public void deleteTask(long taskId) {
        Task task = requireTask(taskId);
        if (!store.deleteTask(taskId)) {
            throw new TaskNotFoundException(taskId);
        }
        log.info("Deleted task {} from project {}", taskId, task.projectId());
        eventBus.publish(OpturaEvent.of("task.deleted", task.projectId(), taskId, "system",
                Map.of("name", String.valueOf(task.name()))));
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    /**
     * @throws GateViolationException when the task has no spec
     */
    public Task approve(long taskId, String approverId) {
        requireText(approverId, "Approver is required");
        return transition(taskId, "approve", approverId,
                task -> lifecycle.approve(task, approverId), Map.of());
    }

    public Task reject(long taskId, String rejectorId, String reason) {
        requireText(rejectorId, "Rejector is required");
        requireText(reason, "Rejection reason is required");
        return transition(taskId, "reject", rejectorId,
                task -> lifecycle.reject(task, rejectorId, reason), Map.of("reason", reason));
    }

    /**
     * @throws GateViolationException when test results are missing or failed, or approval is outstanding
     */
    public Task complete(long taskId) {
        return transition(taskId, "complete", "system", lifecycle::complete, Map.of());
    }

    // ── Dependencies ────────────────────────────────────────────────────

    /**
     * Records that {@code taskId} depends on {@code dependsOnTaskId}. Cycles are only
     * refused here when eager rejection is configured; otherwise they surface as a
     * circular-dependency result of the critical path.
     */
    public TaskDependency addDependency(long taskId, long dependsOnTaskId) {
        Task task = store.findTask(taskId).orElse(null);
        Task prerequisite = store.findTask(dependsOnTaskId).orElse(null);
        if (task == null || prerequisite == null) {
            throw new DependencyEndpointNotFoundException(taskId, dependsOnTaskId);
        }
        if (taskId == dependsOnTaskId) {
            throw new InvalidDependencyException(InvalidDependencyException.Reason.SELF_DEPENDENCY,
                    "Task cannot depend on itself");
        }
        if (task.projectId() != prerequisite.projectId()) {
            throw new InvalidDependencyException(InvalidDependencyException.Reason.CROSS_PROJECT,
                    "Task " + taskId + " and task " + dependsOnTaskId + " belong to different projects");
        }

        var dependency = new TaskDependency(taskId, dependsOnTaskId);
        if (properties.isRejectCyclesEagerly() && closesCycle(task.projectId(), dependency)) {
            throw new InvalidDependencyException(InvalidDependencyException.Reason.CYCLE,
                    "Dependency " + taskId + " -> " + dependsOnTaskId + " would create a circular dependency");
        }

        if (store.saveDependency(dependency)) {
            log.info("Task {} now depends on task {}", taskId, dependsOnTaskId);
            eventBus.publish(OpturaEvent.of("dependency.created", task.projectId(), taskId, "system",
                    Map.of("depends_on_task_id", dependsOnTaskId)));
        } else {
            log.debug("Dependency {} -> {} already exists", taskId, dependsOnTaskId);
        }
        return dependency;
    }

    // ── Spec generation ─────────────────────────────────────────────────

    public Task generateSpec(long taskId) {
        Task task = requireTask(taskId);
        TaskSpecification spec = advisor.generateSpec(task, "Project ID: " + task.projectId());
        Map<String, Object> specDocument = objectMapper.convertValue(spec, SPEC_TYPE);
        double confidence = spec.confidenceScore() != null ? spec.confidenceScore() : DEFAULT_SPEC_CONFIDENCE;
        return transition(taskId, "generate_spec", "spec_generator",
                current -> current.withSpec(specDocument, confidence),
                Map.of("confidence_score", confidence));
    }

    // ── Internals ───────────────────────────────────────────────────────

    private Task transition(long taskId, String action, String actor,
                            UnaryOperator<Task> step, Map<String, Object> details) {
        MdcContext.setAction(action);
        try {
            int conflicts = 0;
            while (true) {
                Task current = requireTask(taskId);
                MdcContext.setTask(current.projectId(), taskId);

                Task next;
                try {
                    next = step.apply(current);
                } catch (GateViolationException e) {
                    metrics.recordGateViolation(e.gate().name());
                    throw e;
                }

                try {
                    Task saved = store.saveTask(next);
                    metrics.recordTransition(action);
                    publishTransition(action, actor, saved, details);
                    return saved;
                } catch (StaleTaskException e) {
                    metrics.recordTransitionConflict();
                    conflicts++;
                    if (conflicts > properties.getMaxConflictRetries()) {
                        log.warn("Giving up on {} for task {} after {} conflict(s)", action, taskId, conflicts);
                        throw new TransitionConflictException(taskId, conflicts, e);
                    }
                    log.info("Concurrent write on task {} during {}, re-checking ({}/{})",
                            taskId, action, conflicts, properties.getMaxConflictRetries());
                }
            }
        } finally {
            MdcContext.clear();
        }
    }

    private void publishTransition(String action, String actor, Task saved, Map<String, Object> details) {
        String eventType = switch (action) {
            case "approve" -> "task.approved";
            case "reject" -> "task.rejected";
            case "complete" -> "task.completed";
            case "generate_spec" -> "spec.generated";
            default -> "task.updated";
        };
        var payload = new HashMap<String, Object>(details);
        payload.put("status", saved.status().name());
        eventBus.publish(OpturaEvent.of(eventType, saved.projectId(), saved.id(), actor, payload));
    }

    private boolean closesCycle(long projectId, TaskDependency candidate) {
        ProjectSnapshot snapshot = store.snapshot(projectId);
        var edges = new ArrayList<>(snapshot.dependencies());
        edges.add(candidate);
        return !graphBuilder.build(projectId, snapshot.tasks(), edges).isAcyclic();
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }

    private Task requireTask(long taskId) {
        return store.findTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }
}
