package com.optura.core.model;

/**
 * Lifecycle status of a task within a project.
 * <p>
 * {@link #COMPLETED} and {@link #FAILED} are terminal for scheduling purposes.
 */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    BLOCKED,
    REVIEW,     // awaiting human sign-off when the task requires approval
    APPROVED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return switch (this) {
            case COMPLETED, FAILED -> true;
            case PENDING, IN_PROGRESS, BLOCKED, REVIEW, APPROVED -> false;
        };
    }
}
