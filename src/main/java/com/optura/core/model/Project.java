package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A project groups tasks. The orchestration core only reads its identity;
 * status and risk level are updated by plan bootstrap.
 *
 * @param id                 store-assigned identifier; {@code null} before the first save
 * @param name               display name
 * @param description        free-form description
 * @param goal               what the project should achieve
 * @param acceptanceCriteria criteria handed to the planner
 * @param environment        target environment hint for the planner (nullable)
 * @param riskLevel          aggregate risk
 * @param status             aggregate status
 * @param createdBy          creator identity
 */
public record Project(
    Long id,
    String name,
    String description,
    String goal,
    @JsonProperty("acceptance_criteria") List<String> acceptanceCriteria,
    String environment,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    ProjectStatus status,
    @JsonProperty("created_by") String createdBy
) {

    public Project withId(Long newId) {
        return new Project(newId, name, description, goal, acceptanceCriteria, environment,
                riskLevel, status, createdBy);
    }

    public Project withPlanning(RiskLevel newRiskLevel) {
        return new Project(id, name, description, goal, acceptanceCriteria, environment,
                newRiskLevel, ProjectStatus.PLANNING, createdBy);
    }
}
