package com.optura.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/tasks/dependencies.
 */
public record DependencyRequest(
    @JsonProperty("task_id") Long taskId,
    @JsonProperty("depends_on_task_id") Long dependsOnTaskId
) {}
