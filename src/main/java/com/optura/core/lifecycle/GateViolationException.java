package com.optura.core.lifecycle;

/**
 * Thrown when a lifecycle transition is attempted while one of its gates does not hold.
 * Always correctable by the user; never retried automatically.
 */
public class GateViolationException extends RuntimeException {

    private final Gate gate;
    private final long taskId;

    public GateViolationException(Gate gate, long taskId) {
        super(gate.guidance());
        this.gate = gate;
        this.taskId = taskId;
    }

    public Gate gate() {
        return gate;
    }

    public long taskId() {
        return taskId;
    }
}
