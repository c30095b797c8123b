package com.phillippitts.voicedispatch.service.component;

import com.phillippitts.voicedispatch.domain.Status;

/**
 * A pluggable part of the system: an input, an output or a service.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Constructed once from configuration with a shared {@link StatusNotifier}</li>
 *   <li>{@link #start()} is called once by the dispatcher before the main loop (may throw,
 *       which aborts startup)</li>
 *   <li>{@link #stop()} is called once during shutdown</li>
 * </ol>
 *
 * @see AbstractComponent
 */
public interface Component {

    /**
     * Performs one-time setup. Any exception is fatal to the whole system.
     */
    void start();

    /**
     * Releases resources. Called once on shutdown; after this no status transitions are reported.
     */
    void stop();

    /**
     * @return the current lifecycle status
     */
    Status getStatus();

    /**
     * @return display name, derived from the concrete type
     */
    String getName();
}
