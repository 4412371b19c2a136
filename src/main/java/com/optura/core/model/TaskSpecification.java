package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Machine-readable specification attached to a task before approval.
 */
public record TaskSpecification(
    @JsonProperty("task_name") String taskName,
    String objective,
    Map<String, Object> inputs,
    Map<String, Object> outputs,
    @JsonProperty("test_cases") List<Map<String, Object>> testCases,
    @JsonProperty("edge_cases") List<Map<String, Object>> edgeCases,
    @JsonProperty("security_requirements") List<Map<String, Object>> securityRequirements,
    @JsonProperty("implementation_notes") List<String> implementationNotes,
    @JsonProperty("confidence_score") Double confidenceScore
) {}
