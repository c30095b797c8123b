package com.phillippitts.voicedispatch.service.component;

import com.phillippitts.voicedispatch.domain.Status;

/**
 * How a {@link Component} tells the system about its status changes.
 *
 * <p>Contract for implementations:
 * <ul>
 *   <li>Called from the polling thread on every transition, so it must return quickly</li>
 *   <li>Must accept components it has never seen before</li>
 *   <li>Must not throw: failures are logged and swallowed by the implementation</li>
 * </ul>
 */
@FunctionalInterface
public interface StatusNotifier {

    /** Notifier that discards every update. */
    StatusNotifier NOOP = (component, status) -> { };

    /**
     * Records a status change for a component.
     *
     * @param component the component whose status changed
     * @param status    its new status
     */
    void update(Component component, Status status);
}
