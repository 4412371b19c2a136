package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A task held back by prerequisites that are not yet completed.
 *
 * @param blockedBy names of the unmet prerequisites
 */
public record BlockedTask(
    @JsonProperty("task_id") long taskId,
    String name,
    @JsonProperty("blocked_by") List<String> blockedBy
) {}
