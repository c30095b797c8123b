package com.phillippitts.voicedispatch.service.handler;

import com.phillippitts.voicedispatch.domain.Token;

import java.util.List;

/**
 * Single-use action produced by a {@link Service} for one dispatch cycle.
 *
 * <p>Handlers are ranked by {@link #belief()}, highest first, and invoked in that order.
 */
public interface Handler {

    /**
     * Performs the action, which may have side effects.
     *
     * @return the outcome, or {@code null} if there is nothing to report
     */
    Result handle();

    /**
     * Self-reported confidence, nominally in [0, 1]. Values outside the range are accepted
     * and only affect ordering.
     */
    double belief();

    /** @return the service that produced this handler */
    Service service();

    /** @return the tokens this handler was evaluated against */
    List<Token> tokens();
}
