package com.optura.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Longest-duration path through a project's dependency graph.
 * <p>
 * A detected cycle is reported through {@link #error} rather than thrown;
 * in that case the path is empty and the total is zero.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CriticalPathResult(
    @JsonProperty("project_id") long projectId,
    @JsonProperty("critical_path") List<TaskRef> path,
    @JsonProperty("total_hours") double totalHours,
    String error
) {

    public static final String CIRCULAR_DEPENDENCY = "circular_dependency";

    public static CriticalPathResult empty(long projectId) {
        return new CriticalPathResult(projectId, List.of(), 0.0, null);
    }

    public static CriticalPathResult circular(long projectId) {
        return new CriticalPathResult(projectId, List.of(), 0.0, CIRCULAR_DEPENDENCY);
    }

    public boolean circularDependency() {
        return CIRCULAR_DEPENDENCY.equals(error);
    }
}
