package com.phillippitts.voicedispatch.service.events;

import com.phillippitts.voicedispatch.service.dispatch.event.HandlerFailedEvent;
import com.phillippitts.voicedispatch.service.dispatch.event.OutputFailedEvent;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    static class MutableClock extends Clock {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener();
        // shouldLog allows first occurrence
        assertThat(l.shouldLog("handler-PurpleAirService")).isTrue();
        // but rejects immediately repeated
        assertThat(l.shouldLog("handler-PurpleAirService")).isFalse();
        // other keys are throttled independently
        assertThat(l.shouldLog("output-ClipboardOutput")).isTrue();
    }

    @Test
    void logsAgainAfterThrottleWindow() {
        MutableClock clock = new MutableClock();
        ErrorEventsListener l = new ErrorEventsListener(clock);

        assertThat(l.shouldLog("k")).isTrue();
        clock.now = clock.now.plus(Duration.ofSeconds(30));
        assertThat(l.shouldLog("k")).isFalse();
        clock.now = clock.now.plus(Duration.ofMinutes(2));
        assertThat(l.shouldLog("k")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ErrorEventsListener l = new ErrorEventsListener();

        assertThatCode(() -> {
            l.onHandlerFailed(new HandlerFailedEvent("PurpleAirService", "PurpleAirHandler", "SensorDataException", Instant.now()));
            l.onHandlerFailed(new HandlerFailedEvent("PurpleAirService", "PurpleAirHandler", "SensorDataException", Instant.now()));
            l.onOutputFailed(new OutputFailedEvent("ClipboardOutput", "IllegalStateException", Instant.now()));
        }).doesNotThrowAnyException();
    }
}
