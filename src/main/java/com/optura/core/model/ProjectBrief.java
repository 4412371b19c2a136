package com.optura.core.model;

import java.util.List;

/**
 * What the planner needs to know about a project.
 */
public record ProjectBrief(
    String projectName,
    String goal,
    String description,
    List<String> acceptanceCriteria,
    String environment
) {

    public static ProjectBrief of(Project project) {
        return new ProjectBrief(project.name(), project.goal(), project.description(),
                project.acceptanceCriteria() != null ? project.acceptanceCriteria() : List.of(),
                project.environment() != null ? project.environment() : "");
    }
}
