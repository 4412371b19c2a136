package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Readiness partition of a project's open tasks. Lists are complete;
 * any truncation for display happens in the caller.
 */
public record NextActions(
    @JsonProperty("project_id") long projectId,
    List<TaskRef> actionable,
    @JsonProperty("needs_approval") List<TaskRef> needsApproval,
    List<BlockedTask> blocked
) {}
