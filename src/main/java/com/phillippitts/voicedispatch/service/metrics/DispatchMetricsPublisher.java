package com.phillippitts.voicedispatch.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link DispatchMetrics} used by the dispatcher.
 *
 * <p>All methods are no-ops when constructed without metrics, which lets the dispatcher run
 * in unit tests without a meter registry.
 *
 * @since 1.0
 */
@Component
public final class DispatchMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(DispatchMetricsPublisher.class);

    /** Outcome tag: a response was sent to the outputs. */
    public static final String OUTCOME_RESPONDED = "responded";
    /** Outcome tag: key-phrase found but handlers produced no text. */
    public static final String OUTCOME_SILENT = "silent";
    /** Outcome tag: no key-phrase in the batch. */
    public static final String OUTCOME_NO_KEY_PHRASE = "no_key_phrase";
    /** Outcome tag: no service claimed the command. */
    public static final String OUTCOME_APOLOGY = "apology";

    /** Shared no-op instance for tests and builder defaults. */
    public static final DispatchMetricsPublisher NOOP = new DispatchMetricsPublisher(null);

    private final DispatchMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public DispatchMetricsPublisher(DispatchMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("DispatchMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordCycle(String outcome) {
        if (metrics != null) {
            metrics.incrementCycle(outcome);
        }
    }

    public void recordHandlerSuccess(String service, long durationNanos) {
        if (metrics != null) {
            metrics.recordHandlerLatency(service, durationNanos);
        }
    }

    public void recordHandlerFailure(String service, Throwable error) {
        if (metrics != null) {
            metrics.incrementHandlerFailure(service, error.getClass().getSimpleName());
        }
    }

    public void recordOutputFailure(String output) {
        if (metrics != null) {
            metrics.incrementOutputFailure(output);
        }
    }

    /** @return true if metrics are recorded, false in test mode */
    public boolean isEnabled() {
        return metrics != null;
    }
}
