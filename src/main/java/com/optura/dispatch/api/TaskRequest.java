package com.optura.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.optura.core.model.Task;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/tasks.
 *
 * @param projectId        owning project
 * @param name             task name; required
 * @param estimateHours    estimated effort; nullable
 * @param requiresApproval nullable, defaults to {@code false}
 * @param order            nullable, defaults to 0
 */
public record TaskRequest(
    @JsonProperty("project_id") Long projectId,
    String name,
    String description,
    Map<String, Object> inputs,
    Map<String, Object> outputs,
    List<Map<String, Object>> tests,
    @JsonProperty("estimate_hours") Double estimateHours,
    @JsonProperty("requires_approval") Boolean requiresApproval,
    Integer order,
    Map<String, Object> spec,
    @JsonProperty("confidence_score") Double confidenceScore
) {

    Task toDraft() {
        if (projectId == null) {
            throw new IllegalArgumentException("project_id is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name is required");
        }
        return Task.newTask(projectId, name, description, inputs, outputs, tests, estimateHours,
                requiresApproval != null && requiresApproval,
                order != null ? order : 0,
                spec, confidenceScore);
    }
}
