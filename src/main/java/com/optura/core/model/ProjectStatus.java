package com.optura.core.model;

/**
 * Aggregate status of a project.
 */
public enum ProjectStatus {
    DRAFT,
    PLANNING,
    IN_PROGRESS,
    REVIEW,
    COMPLETED,
    ARCHIVED
}
