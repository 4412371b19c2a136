package com.optura.core.store;

/**
 * Thrown by {@link TaskStore#saveTask} when the stored version no longer matches
 * the version the caller read, i.e. someone else wrote the task in between.
 */
public class StaleTaskException extends RuntimeException {

    private final long taskId;

    public StaleTaskException(long taskId, long expectedVersion, long actualVersion) {
        super("Task " + taskId + " was modified concurrently (expected version "
                + expectedVersion + ", found " + actualVersion + ")");
        this.taskId = taskId;
    }

    public long taskId() {
        return taskId;
    }
}
