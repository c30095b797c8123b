package com.phillippitts.voicedispatch.service.notifier;

import com.phillippitts.voicedispatch.domain.Status;

import java.time.Instant;

/** Published for every component status transition. */
public record ComponentStatusChangedEvent(String component, ComponentGroup group, Status status, Instant at) { }
