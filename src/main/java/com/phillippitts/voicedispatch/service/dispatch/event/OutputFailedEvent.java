package com.phillippitts.voicedispatch.service.dispatch.event;

import java.time.Instant;

/** Published when an output fails to deliver a response. */
public record OutputFailedEvent(String output, String reason, Instant at) { }
