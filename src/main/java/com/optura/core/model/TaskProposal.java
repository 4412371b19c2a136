package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * A task suggested by the planner. {@code dependencies} are indices into the
 * enclosing {@link TaskPlan#tasks()} list, resolved to task ids at bootstrap.
 */
public record TaskProposal(
    String name,
    String description,
    Map<String, Object> inputs,
    Map<String, Object> outputs,
    List<Map<String, Object>> tests,
    @JsonProperty("estimate_hours") Double estimateHours,
    Integer order,
    @JsonProperty("requires_approval") boolean requiresApproval,
    @JsonProperty("confidence_score") Double confidenceScore,
    List<Integer> dependencies
) {}
