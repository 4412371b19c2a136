package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single order move produced by reprioritization.
 */
public record PriorityChange(
    @JsonProperty("task_id") long taskId,
    String name,
    @JsonProperty("old_order") int oldOrder,
    @JsonProperty("new_order") int newOrder
) {}
