package com.optura.core.engine;

/**
 * Thrown when a dependency names a task that does not exist.
 */
public class DependencyEndpointNotFoundException extends RuntimeException {

    public DependencyEndpointNotFoundException(long taskId, long dependsOnTaskId) {
        super("One or both tasks not found: " + taskId + " -> " + dependsOnTaskId);
    }
}
