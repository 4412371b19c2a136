package com.optura.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.optura.core.model.Project;
import com.optura.core.model.RiskLevel;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/projects.
 */
public record ProjectRequest(
    String name,
    String description,
    String goal,
    @JsonProperty("acceptance_criteria") List<String> acceptanceCriteria,
    String environment,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("created_by") String createdBy
) {

    Project toDraft() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Project name is required");
        }
        return new Project(null, name, description, goal, acceptanceCriteria, environment,
                riskLevel, null, createdBy);
    }
}
