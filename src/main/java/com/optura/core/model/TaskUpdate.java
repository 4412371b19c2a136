package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Partial update of a task; {@code null} fields are left unchanged.
 * <p>
 * Collaborators outside the lifecycle (verification, sandbox runs) use this to
 * record test results or move a task into {@link TaskStatus#REVIEW} or
 * {@link TaskStatus#BLOCKED}.
 */
public record TaskUpdate(
    String name,
    String description,
    Map<String, Object> inputs,
    Map<String, Object> outputs,
    List<Map<String, Object>> tests,
    @JsonProperty("estimate_hours") Double estimateHours,
    TaskStatus status,
    @JsonProperty("requires_approval") Boolean requiresApproval,
    Integer order,
    Map<String, Object> spec,
    @JsonProperty("test_results") Map<String, Object> testResults,
    @JsonProperty("confidence_score") Double confidenceScore
) {

    public Task applyTo(Task task) {
        return new Task(
                task.id(),
                task.projectId(),
                name != null ? name : task.name(),
                description != null ? description : task.description(),
                inputs != null ? inputs : task.inputs(),
                outputs != null ? outputs : task.outputs(),
                tests != null ? tests : task.tests(),
                estimateHours != null ? estimateHours : task.estimateHours(),
                status != null ? status : task.status(),
                requiresApproval != null ? requiresApproval : task.requiresApproval(),
                task.approvedBy(),
                task.approvedAt(),
                task.rejectionReason(),
                order != null ? order : task.order(),
                spec != null ? spec : task.spec(),
                testResults != null ? testResults : task.testResults(),
                confidenceScore != null ? confidenceScore : task.confidenceScore(),
                task.version());
    }
}
