package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Dashboard view combining task counts, progress, critical path and readiness.
 *
 * @param taskCounts          count per status; every status is present
 * @param progressPercent     completed estimate over total estimate, two decimals
 * @param nextActions         first few actionable tasks
 * @param circularDependency  whether the critical path computation found a cycle
 */
public record StatusSummary(
    @JsonProperty("project_id") long projectId,
    @JsonProperty("project_name") String projectName,
    ProjectStatus status,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("task_counts") Map<TaskStatus, Integer> taskCounts,
    @JsonProperty("total_tasks") int totalTasks,
    @JsonProperty("total_estimate_hours") double totalEstimateHours,
    @JsonProperty("completed_estimate_hours") double completedEstimateHours,
    @JsonProperty("progress_percent") double progressPercent,
    @JsonProperty("critical_path_hours") double criticalPathHours,
    @JsonProperty("next_actions") List<TaskRef> nextActions,
    @JsonProperty("needs_approval") List<TaskRef> needsApproval,
    @JsonProperty("circular_dependency") boolean circularDependency
) {}
