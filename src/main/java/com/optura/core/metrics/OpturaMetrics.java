package com.optura.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for orchestration and task lifecycle.
 */
@Service
public class OpturaMetrics {

    private final MeterRegistry registry;

    public OpturaMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String action) {
        Counter.builder("optura.lifecycle.transitions")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordGateViolation(String gate) {
        Counter.builder("optura.lifecycle.gate_violations")
                .description("Lifecycle transitions refused by a gate")
                .tag("gate", gate)
                .register(registry)
                .increment();
    }

    public void recordTransitionConflict() {
        Counter.builder("optura.lifecycle.conflicts")
                .description("Optimistic-concurrency conflicts during lifecycle transitions")
                .register(registry)
                .increment();
    }

    public void recordCriticalPath(long ms, boolean circular) {
        Timer.builder("optura.critical_path.duration")
                .tag("result", circular ? "circular" : "ok")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCycleDetected() {
        Counter.builder("optura.graph.cycles_detected")
                .register(registry)
                .increment();
    }

    public void recordReprioritization(int changes) {
        DistributionSummary.builder("optura.reprioritize.changes")
                .register(registry)
                .record(changes);
    }

    public void recordAdvisorFallback(String kind) {
        Counter.builder("optura.advisor.fallbacks")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
