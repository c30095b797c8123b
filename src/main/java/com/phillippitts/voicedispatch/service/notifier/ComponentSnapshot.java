package com.phillippitts.voicedispatch.service.notifier;

import com.phillippitts.voicedispatch.domain.Status;

import java.time.Instant;

/**
 * Last known status of one component.
 *
 * @param name   component display name
 * @param group  component role
 * @param status latest reported status
 * @param since  when that status was reported
 */
public record ComponentSnapshot(String name, ComponentGroup group, Status status, Instant since) { }
