package com.optura.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for audit events.
 * <p>
 * Supports per-project subscriptions and global subscriptions that receive all events.
 * A failing subscriber never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-project subscribers keyed by projectId. */
    private final ConcurrentHashMap<Long, CopyOnWriteArrayList<Consumer<OpturaEvent>>> projectSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all projects. */
    private final CopyOnWriteArrayList<Consumer<OpturaEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(OpturaEvent event) {
        log.debug("Publishing event: {} for project {}", event.eventType(), event.projectId());

        List<Consumer<OpturaEvent>> projectSubs = projectSubscribers.get(event.projectId());
        if (projectSubs != null) {
            for (Consumer<OpturaEvent> subscriber : projectSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<OpturaEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific project.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(long projectId, Consumer<OpturaEvent> consumer) {
        projectSubscribers.computeIfAbsent(projectId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to project {}", projectId);
        return () -> {
            CopyOnWriteArrayList<Consumer<OpturaEvent>> subs = projectSubscribers.get(projectId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<OpturaEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<OpturaEvent> subscriber, OpturaEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
