package com.phillippitts.meetingrouter.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for meeting-event processing.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Routing outcomes (matched, fallback, unmatched)</li>
 *   <li>Per-stage outcomes (comment, extraction, parent task)</li>
 *   <li>Subtask creation results</li>
 *   <li>End-to-end processing latency</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available under /actuator/metrics.
 */
public class OrchestrationMetrics {

    private static final String METRIC_PREFIX = "meetingrouter";

    private final MeterRegistry registry;

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * @param outcome matched, fallback or unmatched
     */
    public void recordRouting(String outcome) {
        Counter.builder(METRIC_PREFIX + ".routing")
                .description("Meeting events by routing outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * @param stage   comment, extraction or parent_task
     * @param outcome lower-cased stage status (success, skipped, isolated_failure, aborted)
     */
    public void recordStage(String stage, String outcome) {
        Counter.builder(METRIC_PREFIX + ".stage")
                .description("Pipeline stage outcomes")
                .tag("stage", stage)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordSubtask(boolean created) {
        Counter.builder(METRIC_PREFIX + ".subtasks")
                .description("Subtask creation attempts")
                .tag("result", created ? "created" : "failed")
                .register(registry)
                .increment();
    }

    public void recordLatency(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".orchestration.latency")
                .description("Time taken to process one meeting event")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
