package com.processflow.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer meters for instance lifecycle events.
 *
 * Metrics exposed:
 * - Instances started, completed, cancelled, failed and retried, by definition
 * - Optimistic commit conflicts, by operation
 * - Instance duration from start to a terminal status, by outcome
 */
public class ProcessMetrics {

    public static final String INSTANCES_STARTED = "processflow.instances.started";
    public static final String INSTANCES_COMPLETED = "processflow.instances.completed";
    public static final String INSTANCES_CANCELLED = "processflow.instances.cancelled";
    public static final String INSTANCES_FAILED = "processflow.instances.failed";
    public static final String INSTANCES_RETRIED = "processflow.instances.retried";
    public static final String CONFLICTS = "processflow.instances.conflicts";
    public static final String INSTANCE_DURATION = "processflow.instance.duration";

    private final MeterRegistry registry;

    public ProcessMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void instanceStarted(String definitionName) {
        counter(INSTANCES_STARTED, "Total process instances started", definitionName).increment();
    }

    public void instanceCompleted(String definitionName, Duration duration) {
        counter(INSTANCES_COMPLETED, "Total process instances completed", definitionName).increment();
        recordDuration(definitionName, "completed", duration);
    }

    public void instanceCancelled(String definitionName, Duration duration) {
        counter(INSTANCES_CANCELLED, "Total process instances cancelled", definitionName).increment();
        recordDuration(definitionName, "cancelled", duration);
    }

    public void instanceFailed(String definitionName, Duration duration) {
        counter(INSTANCES_FAILED, "Total process instances failed", definitionName).increment();
        recordDuration(definitionName, "failed", duration);
    }

    public void instanceRetried(String definitionName) {
        counter(INSTANCES_RETRIED, "Total failed process instances retried", definitionName).increment();
    }

    public void commitConflict(String operation) {
        Counter.builder(CONFLICTS)
            .tag("operation", operation)
            .description("Concurrent modifications rejected by optimistic locking")
            .register(registry)
            .increment();
    }

    private Counter counter(String name, String description, String definitionName) {
        return Counter.builder(name)
            .tag("definition", definitionName == null ? "unknown" : definitionName)
            .description(description)
            .register(registry);
    }

    private void recordDuration(String definitionName, String outcome, Duration duration) {
        if (duration == null) {
            return;
        }
        Timer.builder(INSTANCE_DURATION)
            .tag("definition", definitionName == null ? "unknown" : definitionName)
            .tag("outcome", outcome)
            .description("Process instance duration from start to a terminal status")
            .register(registry)
            .record(duration);
    }
}
