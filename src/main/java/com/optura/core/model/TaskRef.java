package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lightweight reference to a task as it appears in orchestration results.
 *
 * @param taskId        task identifier
 * @param name          task name
 * @param estimateHours effective duration on a critical path, raw estimate elsewhere (nullable)
 * @param status        status at the time of the snapshot
 */
public record TaskRef(
    @JsonProperty("task_id") long taskId,
    String name,
    @JsonProperty("estimate_hours") Double estimateHours,
    TaskStatus status
) {}
