package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Node of the dependency graph as exposed for visualization.
 */
public record GraphNodeView(
    long id,
    String name,
    TaskStatus status,
    @JsonProperty("estimate_hours") Double estimateHours,
    @JsonProperty("requires_approval") boolean requiresApproval,
    int order
) {}
