package com.phillippitts.voicedispatch.service.dispatch.event;

import java.time.Instant;

/** Published when a handler throws while producing a response. */
public record HandlerFailedEvent(String service, String handler, String reason, Instant at) { }
