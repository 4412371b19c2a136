package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ReprioritizeResult(
    @JsonProperty("project_id") long projectId,
    List<PriorityChange> changes,
    @JsonProperty("total_tasks") int totalTasks
) {}
