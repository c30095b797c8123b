package com.phillippitts.voicedispatch.service.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DispatchMetricsTest {

    private SimpleMeterRegistry registry;
    private DispatchMetricsPublisher publisher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        publisher = new DispatchMetricsPublisher(new DispatchMetrics(registry));
    }

    @Test
    void countsCyclesByOutcome() {
        publisher.recordCycle(DispatchMetricsPublisher.OUTCOME_RESPONDED);
        publisher.recordCycle(DispatchMetricsPublisher.OUTCOME_RESPONDED);
        publisher.recordCycle(DispatchMetricsPublisher.OUTCOME_APOLOGY);

        assertThat(registry.get("voicedispatch.cycles").tag("outcome", "responded").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("voicedispatch.cycles").tag("outcome", "apology").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void recordsHandlerLatencyAndFailuresPerService() {
        publisher.recordHandlerSuccess("PurpleAirService", TimeUnit.MILLISECONDS.toNanos(250));
        publisher.recordHandlerFailure("PurpleAirService", new IllegalStateException("down"));

        assertThat(registry.get("voicedispatch.handler.latency").tag("service", "PurpleAirService")
                .timer().totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250.0);
        assertThat(registry.get("voicedispatch.handler.failure")
                .tag("service", "PurpleAirService")
                .tag("reason", "IllegalStateException")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void countsOutputFailures() {
        publisher.recordOutputFailure("ClipboardOutput");

        assertThat(registry.get("voicedispatch.output.failure").tag("output", "ClipboardOutput")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void noopPublisherRecordsNothing() {
        DispatchMetricsPublisher.NOOP.recordCycle(DispatchMetricsPublisher.OUTCOME_SILENT);
        DispatchMetricsPublisher.NOOP.recordHandlerFailure("S", new RuntimeException());

        assertThat(DispatchMetricsPublisher.NOOP.isEnabled()).isFalse();
        assertThat(publisher.isEnabled()).isTrue();
    }
}
