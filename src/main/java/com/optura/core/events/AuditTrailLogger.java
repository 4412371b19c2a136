package com.optura.core.events;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes every published event to the {@code optura.audit} logger.
 * Durable audit storage lives outside this service.
 */
@Component
public class AuditTrailLogger {

    private static final Logger audit = LoggerFactory.getLogger("optura.audit");

    private final EventBus eventBus;
    private EventBus.Subscription subscription;

    public AuditTrailLogger(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @PostConstruct
    void start() {
        subscription = eventBus.subscribeAll(this::record);
    }

    @PreDestroy
    void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
    }

    void record(OpturaEvent event) {
        audit.info("action={} project={} task={} actor={} details={}",
                event.eventType(), event.projectId(), event.taskId(), event.actor(), event.payload());
    }
}
