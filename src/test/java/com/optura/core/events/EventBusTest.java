package com.optura.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static OpturaEvent event(String type, long projectId) {
        return OpturaEvent.of(type, projectId, 1L, "system", Map.of("k", "v"));
    }

    @Test
    @DisplayName("Project subscribers only see their project's events")
    void projectScoped() {
        var received = new ArrayList<OpturaEvent>();
        eventBus.subscribe(1L, received::add);

        eventBus.publish(event("task.created", 1L));
        eventBus.publish(event("task.created", 2L));

        assertEquals(1, received.size());
        assertEquals(1L, received.get(0).projectId());
    }

    @Test
    @DisplayName("Global subscribers see every event")
    void global() {
        var received = new ArrayList<OpturaEvent>();
        eventBus.subscribeAll(received::add);

        eventBus.publish(event("task.created", 1L));
        eventBus.publish(event("task.approved", 2L));

        assertEquals(List.of("task.created", "task.approved"),
                received.stream().map(OpturaEvent::eventType).toList());
    }

    @Test
    @DisplayName("Unsubscribed consumers stop receiving events")
    void unsubscribe() {
        var received = new ArrayList<OpturaEvent>();
        var subscription = eventBus.subscribe(1L, received::add);
        var global = eventBus.subscribeAll(received::add);

        subscription.unsubscribe();
        global.unsubscribe();
        eventBus.publish(event("task.created", 1L));

        assertTrue(received.isEmpty());
    }

    @Test
    @DisplayName("A failing subscriber does not affect the others")
    void failingSubscriber() {
        var received = new ArrayList<OpturaEvent>();
        eventBus.subscribeAll(e -> { throw new IllegalStateException("boom"); });
        eventBus.subscribeAll(received::add);

        assertDoesNotThrow(() -> eventBus.publish(event("task.created", 1L)));
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("Null payload becomes an empty map")
    void nullPayload() {
        assertEquals(Map.of(), OpturaEvent.of("x", 1L, null, "system", null).payload());
    }
}
