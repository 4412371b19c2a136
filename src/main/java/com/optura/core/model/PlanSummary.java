package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of turning a generated plan into tasks and dependencies.
 */
public record PlanSummary(
    @JsonProperty("project_id") long projectId,
    @JsonProperty("task_count") int taskCount,
    @JsonProperty("task_ids") List<Long> taskIds,
    @JsonProperty("dependency_count") int dependencyCount,
    @JsonProperty("estimated_total_hours") double estimatedTotalHours,
    @JsonProperty("risk_level") RiskLevel riskLevel
) {}
