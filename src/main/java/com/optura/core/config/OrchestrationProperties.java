package com.optura.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Scheduling and lifecycle parameters, bound from {@code optura.orchestration.*}.
 */
@Component
@ConfigurationProperties(prefix = "optura.orchestration")
public class OrchestrationProperties {

    /** Duration assumed for tasks without a positive estimate. */
    private double defaultDurationHours = 1.0;

    /** Re-reads after an optimistic-concurrency conflict before a transition gives up. */
    private int maxConflictRetries = 3;

    /** Refuse cycle-closing edges at creation time instead of reporting them at analysis time. */
    private boolean rejectCyclesEagerly = false;

    public double getDefaultDurationHours() {
        return defaultDurationHours;
    }

    public void setDefaultDurationHours(double defaultDurationHours) {
        this.defaultDurationHours = defaultDurationHours;
    }

    public int getMaxConflictRetries() {
        return maxConflictRetries;
    }

    public void setMaxConflictRetries(int maxConflictRetries) {
        this.maxConflictRetries = maxConflictRetries;
    }

    public boolean isRejectCyclesEagerly() {
        return rejectCyclesEagerly;
    }

    public void setRejectCyclesEagerly(boolean rejectCyclesEagerly) {
        this.rejectCyclesEagerly = rejectCyclesEagerly;
    }
}
