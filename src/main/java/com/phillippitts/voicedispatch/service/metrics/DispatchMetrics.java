package com.phillippitts.voicedispatch.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for dispatch cycles.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Dispatch cycles by outcome (responded, silent, missed key-phrase, apology)</li>
 *   <li>Handler latency and failures per service</li>
 *   <li>Output delivery failures per output</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class DispatchMetrics {

    private static final String METRIC_PREFIX = "voicedispatch";

    private final MeterRegistry registry;

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts a completed dispatch cycle.
     *
     * @param outcome one of responded, silent, no_key_phrase, apology
     */
    public void incrementCycle(String outcome) {
        Counter.builder(METRIC_PREFIX + ".cycles")
                .description("Number of token batches dispatched")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records how long a handler took to produce its result.
     *
     * @param service name of the owning service
     * @param durationNanos duration in nanoseconds
     */
    public void recordHandlerLatency(String service, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".handler.latency")
                .description("Time taken by handlers to produce a result")
                .tag("service", service)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the handler failure counter.
     *
     * @param service name of the owning service
     * @param reason exception type
     */
    public void incrementHandlerFailure(String service, String reason) {
        Counter.builder(METRIC_PREFIX + ".handler.failure")
                .description("Number of handlers that threw")
                .tag("service", service)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Increments the output failure counter.
     *
     * @param output name of the output
     */
    public void incrementOutputFailure(String output) {
        Counter.builder(METRIC_PREFIX + ".output.failure")
                .description("Number of failed response deliveries")
                .tag("output", output)
                .register(registry)
                .increment();
    }
}
