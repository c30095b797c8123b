package com.phillippitts.voicedispatch.testutil;

import com.phillippitts.voicedispatch.domain.Token;
import com.phillippitts.voicedispatch.service.component.AbstractComponent;
import com.phillippitts.voicedispatch.service.component.StatusNotifier;
import com.phillippitts.voicedispatch.service.handler.AbstractHandler;
import com.phillippitts.voicedispatch.service.handler.Handler;
import com.phillippitts.voicedispatch.service.handler.Result;
import com.phillippitts.voicedispatch.service.handler.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Service that claims every command with a fixed belief and answers with a scripted result.
 * Records the tokens it was asked to evaluate and whether its handler ran.
 */
public class StubService extends AbstractComponent implements Service {

    private final String name;
    private final Double belief;
    private final Supplier<Result> result;
    private final List<List<Token>> evaluated = new CopyOnWriteArrayList<>();
    private final List<String> handled = new CopyOnWriteArrayList<>();
    private volatile RuntimeException evaluateFailure;
    private volatile RuntimeException stopFailure;
    private volatile RuntimeException startFailure;

    private StubService(String name, Double belief, Supplier<Result> result) {
        super(StatusNotifier.NOOP);
        this.name = name;
        this.belief = belief;
        this.result = result;
    }

    /** A service answering with non-exclusive text. */
    public static StubService answering(String name, double belief, String text) {
        return new StubService(name, belief, () -> Result.of(text));
    }

    /** A service answering with exclusive text. */
    public static StubService exclusive(String name, double belief, String text) {
        return new StubService(name, belief, () -> Result.exclusive(text));
    }

    /** A service whose handler throws. */
    public static StubService failing(String name, double belief, RuntimeException e) {
        return new StubService(name, belief, () -> {
            throw e;
        });
    }

    /** A service whose handler returns the supplied result, possibly null. */
    public static StubService returning(String name, double belief, Supplier<Result> result) {
        return new StubService(name, belief, result);
    }

    /** A service that never claims a command. */
    public static StubService declining(String name) {
        return new StubService(name, null, () -> null);
    }

    public StubService failOnEvaluate(RuntimeException e) {
        this.evaluateFailure = e;
        return this;
    }

    public StubService failOnStop(RuntimeException e) {
        this.stopFailure = e;
        return this;
    }

    public StubService failOnStart(RuntimeException e) {
        this.startFailure = e;
        return this;
    }

    @Override
    protected void doStart() {
        if (startFailure != null) {
            throw startFailure;
        }
    }

    @Override
    protected void doStop() {
        if (stopFailure != null) {
            throw stopFailure;
        }
    }

    @Override
    public Handler evaluate(List<Token> tokens) {
        evaluated.add(tokens);
        if (evaluateFailure != null) {
            throw evaluateFailure;
        }
        if (belief == null) {
            return null;
        }
        return new AbstractHandler(this, tokens, belief) {
            @Override
            public Result handle() {
                handled.add(name);
                return result.get();
            }
        };
    }

    public List<List<Token>> evaluated() {
        return evaluated;
    }

    public boolean wasHandled() {
        return !handled.isEmpty();
    }

    @Override
    public String getName() {
        return name;
    }
}
