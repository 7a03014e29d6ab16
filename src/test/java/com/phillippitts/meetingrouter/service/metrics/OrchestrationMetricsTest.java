package com.phillippitts.meetingrouter.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OrchestrationMetricsTest {

    private MeterRegistry registry;
    private OrchestrationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OrchestrationMetrics(registry);
    }

    @Test
    void shouldCountRoutingOutcomesSeparately() {
        metrics.recordRouting("matched");
        metrics.recordRouting("matched");
        metrics.recordRouting("unmatched");

        Counter matched = registry.find("meetingrouter.routing").tag("outcome", "matched").counter();
        Counter unmatched = registry.find("meetingrouter.routing").tag("outcome", "unmatched").counter();

        assertThat(matched).isNotNull();
        assertThat(matched.count()).isEqualTo(2.0);
        assertThat(unmatched).isNotNull();
        assertThat(unmatched.count()).isEqualTo(1.0);
    }

    @Test
    void shouldTagStageOutcomes() {
        metrics.recordStage("comment", "success");
        metrics.recordStage("extraction", "isolated_failure");

        Counter extraction = registry.find("meetingrouter.stage")
                .tag("stage", "extraction")
                .tag("outcome", "isolated_failure")
                .counter();

        assertThat(extraction).isNotNull();
        assertThat(extraction.count()).isEqualTo(1.0);
        assertThat(registry.find("meetingrouter.stage").tag("stage", "parent_task").counter()).isNull();
    }

    @Test
    void shouldSplitSubtaskResults() {
        metrics.recordSubtask(true);
        metrics.recordSubtask(true);
        metrics.recordSubtask(false);

        assertThat(registry.find("meetingrouter.subtasks").tag("result", "created").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("meetingrouter.subtasks").tag("result", "failed").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldRecordLatency() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(120);

        metrics.recordLatency("completed", durationNanos);

        Timer timer = registry.find("meetingrouter.orchestration.latency")
                .tag("outcome", "completed")
                .timer();

        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }
}
