package com.optura.core.engine;

/**
 * Thrown when a dependency edge is refused at creation time.
 */
public class InvalidDependencyException extends RuntimeException {

    public enum Reason {
        SELF_DEPENDENCY,
        CROSS_PROJECT,
        CYCLE
    }

    private final Reason reason;

    public InvalidDependencyException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
