package com.optura.core.engine;

/**
 * Thrown when a task kept changing underneath a write and the retry budget ran out.
 */
public class TransitionConflictException extends RuntimeException {

    public TransitionConflictException(long taskId, int attempts, Throwable cause) {
        super("Task " + taskId + " was modified concurrently; gave up after " + attempts + " attempt(s)", cause);
    }
}
