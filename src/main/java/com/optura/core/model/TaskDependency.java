package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Directed edge: {@code taskId} cannot become ready until {@code dependsOnTaskId}
 * is {@link TaskStatus#COMPLETED}. Scoped to the project of the dependent task.
 */
public record TaskDependency(
    @JsonProperty("task_id") long taskId,
    @JsonProperty("depends_on_task_id") long dependsOnTaskId
) {}
