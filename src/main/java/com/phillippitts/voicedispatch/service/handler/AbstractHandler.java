package com.phillippitts.voicedispatch.service.handler;

import com.phillippitts.voicedispatch.domain.Token;

import java.util.List;
import java.util.Objects;

/**
 * Holds the service, tokens and belief common to every handler.
 */
public abstract class AbstractHandler implements Handler {

    private final Service service;
    private final List<Token> tokens;
    private final double belief;

    protected AbstractHandler(Service service, List<Token> tokens, double belief) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.tokens = tokens == null ? List.of() : List.copyOf(tokens);
        this.belief = belief;
    }

    @Override
    public final Service service() {
        return service;
    }

    @Override
    public final List<Token> tokens() {
        return tokens;
    }

    @Override
    public final double belief() {
        return belief;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[service=" + service.getName() + ", belief=" + belief + "]";
    }
}
