package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured plan returned by the planner for a project.
 */
public record TaskPlan(
    List<TaskProposal> tasks,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("estimated_total_hours") Double estimatedTotalHours
) {}
