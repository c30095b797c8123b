package com.phillippitts.voicedispatch.service.events;

import com.phillippitts.voicedispatch.service.dispatch.event.HandlerFailedEvent;
import com.phillippitts.voicedispatch.service.dispatch.event.OutputFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error events. Throttled per service or output to avoid
 * log spam when a component fails on every cycle.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener() {
        this(Clock.systemUTC());
    }

    // Package-private for tests
    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onHandlerFailed(HandlerFailedEvent e) {
        if (shouldLog("handler-" + e.service() + '-' + e.reason())) {
            LOG.warn("Service {} keeps failing to handle commands: reason={}. "
                    + "Check its configuration and connectivity.", e.service(), e.reason());
        }
    }

    @EventListener
    void onOutputFailed(OutputFailedEvent e) {
        if (shouldLog("output-" + e.output())) {
            LOG.warn("Output {} failed to deliver a response: reason={}. "
                    + "Responses are still sent to the other outputs.", e.output(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
