package com.optura.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An audit event emitted by task and orchestration operations.
 *
 * @param eventType event type (e.g. "task.approved", "tasks.reprioritized")
 * @param projectId the project this event belongs to
 * @param taskId    the task this event relates to (nullable for project-level events)
 * @param actor     user or component that caused the event
 * @param payload   arbitrary key-value details
 * @param timestamp when the event occurred
 */
public record OpturaEvent(
    String eventType,
    long projectId,
    Long taskId,
    String actor,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static OpturaEvent of(String eventType, long projectId, Long taskId, String actor,
                                 Map<String, Object> payload) {
        return new OpturaEvent(eventType, projectId, taskId, actor,
                payload != null ? payload : Map.of(), Instant.now());
    }
}
