package com.phillippitts.voicedispatch.service.dispatch;

import com.phillippitts.voicedispatch.domain.Token;
import com.phillippitts.voicedispatch.exception.ComponentStartupException;
import com.phillippitts.voicedispatch.service.component.Component;
import com.phillippitts.voicedispatch.service.component.Input;
import com.phillippitts.voicedispatch.service.component.Output;
import com.phillippitts.voicedispatch.service.dispatch.event.HandlerFailedEvent;
import com.phillippitts.voicedispatch.service.dispatch.event.OutputFailedEvent;
import com.phillippitts.voicedispatch.service.handler.Handler;
import com.phillippitts.voicedispatch.service.handler.Result;
import com.phillippitts.voicedispatch.service.handler.Service;
import com.phillippitts.voicedispatch.service.metrics.DispatchMetricsPublisher;
import com.phillippitts.voicedispatch.util.LogSanitizer;
import com.phillippitts.voicedispatch.util.Tokenizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The engine: polls inputs, detects key-phrases, asks services for handlers, runs them in
 * order of belief and sends the accumulated response to every output.
 *
 * <p><b>Cycle:</b>
 * <ol>
 *   <li>Each input is polled with a non-blocking {@link Input#read()}</li>
 *   <li>The batch is projected to lowercase letters-only words and searched for a
 *       key-phrase; without one the batch is dropped silently</li>
 *   <li>Every service evaluates the tokens after the key-phrase; if none claims them the
 *       response is the apology text</li>
 *   <li>Handlers run in descending belief order (stable), texts are concatenated, and an
 *       exclusive result ends the iteration</li>
 *   <li>A non-empty response is written to every output</li>
 * </ol>
 *
 * <p><b>Threading:</b> single threaded and cooperative. Only {@link #requestStop()},
 * {@link #isLooping()} and {@link #awaitTermination(Duration)} may be called from other threads.
 *
 * <p><b>Errors:</b> a component failing to start is fatal ({@link ComponentStartupException}).
 * Failures in evaluation, handlers, outputs and shutdown are logged and never leave the loop.
 *
 * @since 1.0
 * @see KeyPhraseDetector
 */
public class Dispatcher {

    private static final Logger LOG = LogManager.getLogger(Dispatcher.class);

    /** Response used when a key-phrase was heard but no service claimed the command. */
    public static final String DEFAULT_APOLOGY = "I'm sorry, I don't know how to help with that";

    /** Default pause between sweeps over all inputs. */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    private static final String UNKNOWN_SERVICE = "unknown";

    private static final int PREVIEW_CHARS = 120;

    private static final Comparator<Handler> BY_BELIEF_DESCENDING =
            Comparator.comparingDouble(Handler::belief).reversed();

    private final List<Input> inputs;
    private final List<Output> outputs;
    private final List<Service> services;
    private final KeyPhraseDetector detector;
    private final String apology;
    private final Duration pollInterval;
    private final ApplicationEventPublisher publisher;
    private final DispatchMetricsPublisher metrics;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile boolean looping;
    private long cycleCount;

    private Dispatcher(Builder b) {
        this.inputs = List.copyOf(b.inputs);
        this.outputs = List.copyOf(b.outputs);
        this.services = List.copyOf(b.services);
        this.detector = new KeyPhraseDetector(b.keyPhrases.stream().map(KeyPhrase::parse).toList());
        this.apology = b.apology;
        this.pollInterval = b.pollInterval;
        this.publisher = b.publisher;
        this.metrics = b.metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts every component, runs the main loop until stopped, then shuts down.
     *
     * @throws ComponentStartupException if any component fails to start
     */
    public void run() {
        startComponents();
        runLoop();
    }

    /**
     * Starts inputs, outputs and services in that order. If one fails, those already started
     * are stopped again and the failure is rethrown; the main loop must not be entered.
     *
     * @throws ComponentStartupException if any component fails to start
     */
    public void startComponents() {
        LOG.info("Starting the system (inputs={}, outputs={}, services={}, keyPhrases={})",
                inputs.size(), outputs.size(), services.size(), detector.getKeyPhrases());
        List<Component> started = new ArrayList<>();
        for (Component component : allComponents()) {
            LOG.info("Starting {}", component);
            try {
                component.start();
                started.add(component);
            } catch (RuntimeException e) {
                LOG.error("Failed to start {}; aborting startup", component, e);
                running.set(false);
                if (shutdown.compareAndSet(false, true)) {
                    stopAll(started);
                    terminated.countDown();
                }
                throw new ComponentStartupException(component.getName(), e);
            }
        }
    }

    /**
     * Polls the inputs until {@link #requestStop()} is called or the thread is interrupted,
     * then stops every component exactly once.
     */
    public void runLoop() {
        LOG.info("Entering main loop (pollInterval={}ms)", pollInterval.toMillis());
        looping = true;
        try {
            while (running.get()) {
                if (!pollInputs()) {
                    break;
                }
                try {
                    TimeUnit.MILLISECONDS.sleep(pollInterval.toMillis());
                } catch (InterruptedException e) {
                    LOG.warn("Interrupt received while idle; leaving main loop");
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        } finally {
            looping = false;
            shutdown();
        }
    }

    /**
     * One sweep over all inputs.
     *
     * @return false if the thread was interrupted during the sweep
     */
    private boolean pollInputs() {
        for (Input input : inputs) {
            if (Thread.currentThread().isInterrupted()) {
                LOG.warn("Interrupt received between reads; leaving main loop");
                return false;
            }
            List<Token> tokens;
            try {
                tokens = input.read();
            } catch (RuntimeException e) {
                LOG.error("Failed to read from {}: {}", input, e.toString());
                continue;
            }
            if (tokens == null || tokens.isEmpty()) {
                continue;
            }
            ThreadContext.put("cycleId", Long.toString(++cycleCount));
            try {
                LOG.info("Read from {}: '{}'", input, LogSanitizer.preview(tokens, PREVIEW_CHARS));
                String response = handle(tokens);
                if (response != null) {
                    respond(response);
                }
            } finally {
                ThreadContext.remove("cycleId");
            }
        }
        return true;
    }

    /**
     * Handles one batch of tokens.
     *
     * @param tokens tokens read from an input
     * @return the response text, or {@code null} if there is nothing to say (no key-phrase,
     *         or handlers produced no text)
     */
    public String handle(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return null;
        }

        List<String> words = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            words.add(Tokenizer.toLetters(token.element()).toLowerCase(Locale.ROOT));
        }
        OptionalInt offset = detector.findCommandOffset(words);
        if (offset.isEmpty()) {
            LOG.info("Key-phrases {} not found in {}", detector.getKeyPhrases(), words);
            metrics.recordCycle(DispatchMetricsPublisher.OUTCOME_NO_KEY_PHRASE);
            return null;
        }

        List<Token> command = List.copyOf(tokens.subList(offset.getAsInt(), tokens.size()));
        List<Handler> handlers = evaluate(command);
        if (handlers.isEmpty()) {
            LOG.info("No service claimed '{}'", LogSanitizer.preview(command, PREVIEW_CHARS));
            metrics.recordCycle(DispatchMetricsPublisher.OUTCOME_APOLOGY);
            return apology;
        }

        String response = execute(rank(handlers));
        metrics.recordCycle(response == null
                ? DispatchMetricsPublisher.OUTCOME_SILENT
                : DispatchMetricsPublisher.OUTCOME_RESPONDED);
        return response;
    }

    /**
     * Asks every service, in configuration order, whether it claims the command.
     * A service that throws is treated as not applying.
     */
    private List<Handler> evaluate(List<Token> command) {
        List<Handler> handlers = new ArrayList<>();
        for (Service service : services) {
            try {
                Handler handler = service.evaluate(command);
                if (handler != null) {
                    LOG.debug("{} claimed command with belief {}", service, handler.belief());
                    handlers.add(handler);
                }
            } catch (RuntimeException e) {
                LOG.error("Service {} failed to evaluate tokens {}: {}", service, command, e.toString());
            }
        }
        return handlers;
    }

    /**
     * Orders handlers by descending belief. The sort is stable, so equal beliefs keep
     * evaluation order.
     *
     * @param handlers handlers in evaluation order
     * @return a new list, highest belief first
     */
    static List<Handler> rank(List<Handler> handlers) {
        List<Handler> ranked = new ArrayList<>(handlers);
        ranked.sort(BY_BELIEF_DESCENDING);
        return ranked;
    }

    /**
     * Runs handlers in ranked order, concatenating their texts until one is exclusive.
     */
    private String execute(List<Handler> ranked) {
        StringBuilder response = new StringBuilder();
        for (Handler handler : ranked) {
            String serviceName = UNKNOWN_SERVICE;
            long start = System.nanoTime();
            try {
                serviceName = serviceName(handler);
                Result result = handler.handle();
                metrics.recordHandlerSuccess(serviceName, System.nanoTime() - start);
                if (result == null) {
                    continue;
                }
                if (result.text() != null) {
                    response.append(result.text());
                }
                if (result.isExclusive()) {
                    LOG.debug("{} returned an exclusive result; skipping lower-ranked handlers", handler);
                    break;
                }
            } catch (Exception e) {
                LOG.error("Handler {} with tokens {} for service {} failed",
                        handler, handler.tokens(), serviceName, e);
                metrics.recordHandlerFailure(serviceName, e);
                publisher.publishEvent(new HandlerFailedEvent(serviceName, handler.toString(),
                        e.getClass().getSimpleName(), Instant.now()));
            }
        }
        return response.length() > 0 ? response.toString() : null;
    }

    private static String serviceName(Handler handler) {
        Service service = handler.service();
        return service == null ? UNKNOWN_SERVICE : Objects.toString(service.getName(), UNKNOWN_SERVICE);
    }

    /**
     * Sends the response to every output; a failing output does not stop the others.
     */
    private void respond(String response) {
        for (Output output : outputs) {
            try {
                output.write(response);
            } catch (Exception e) {
                LOG.error("Failed to respond with {}: {}", output, e.toString());
                metrics.recordOutputFailure(output.getName());
                publisher.publishEvent(new OutputFailedEvent(output.getName(),
                        e.getClass().getSimpleName(), Instant.now()));
            }
        }
    }

    /**
     * Stops every component exactly once, no matter how often it is called.
     */
    private void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Stopping the system");
        stopAll(allComponents());
        terminated.countDown();
    }

    private static void stopAll(List<? extends Component> components) {
        for (Component component : components) {
            try {
                LOG.info("Stopping {}", component);
                component.stop();
            } catch (Exception e) {
                LOG.error("Failed to stop {}: {}", component, e.toString());
            }
        }
    }

    private List<Component> allComponents() {
        List<Component> all = new ArrayList<>(inputs.size() + outputs.size() + services.size());
        all.addAll(inputs);
        all.addAll(outputs);
        all.addAll(services);
        return all;
    }

    /**
     * Signals the main loop to finish after the current sweep. Safe to call from any thread.
     */
    public void requestStop() {
        if (running.getAndSet(false)) {
            LOG.info("Stop requested");
        }
    }

    /**
     * Waits for the shutdown sequence to complete.
     *
     * @param timeout maximum time to wait
     * @return true if shutdown completed within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** @return true once the shutdown sequence has completed, however the loop ended */
    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    /** @return true while the main loop is polling inputs */
    public boolean isLooping() {
        return looping;
    }

    public List<Input> getInputs() {
        return inputs;
    }

    public List<Output> getOutputs() {
        return outputs;
    }

    public List<Service> getServices() {
        return services;
    }

    public List<KeyPhrase> getKeyPhrases() {
        return detector.getKeyPhrases();
    }

    /**
     * Fluent builder for {@link Dispatcher}. Key-phrases are required; component lists
     * default to empty.
     */
    public static final class Builder {
        private List<Input> inputs = List.of();
        private List<Output> outputs = List.of();
        private List<Service> services = List.of();
        private List<String> keyPhrases;
        private String apology = DEFAULT_APOLOGY;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private ApplicationEventPublisher publisher = event -> { };
        private DispatchMetricsPublisher metrics = DispatchMetricsPublisher.NOOP;

        private Builder() {
        }

        public Builder inputs(List<? extends Input> inputs) {
            this.inputs = List.copyOf(inputs);
            return this;
        }

        public Builder outputs(List<? extends Output> outputs) {
            this.outputs = List.copyOf(outputs);
            return this;
        }

        public Builder services(List<? extends Service> services) {
            this.services = List.copyOf(services);
            return this;
        }

        public Builder keyPhrases(List<String> keyPhrases) {
            this.keyPhrases = List.copyOf(keyPhrases);
            return this;
        }

        public Builder apology(String apology) {
            this.apology = apology;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder publisher(ApplicationEventPublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder metrics(DispatchMetricsPublisher metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * @return a new dispatcher
         * @throws NullPointerException if key-phrases, apology, poll interval, publisher or
         *                              metrics are missing
         * @throws IllegalArgumentException if the poll interval is negative
         */
        public Dispatcher build() {
            Objects.requireNonNull(keyPhrases, "keyPhrases are required");
            Objects.requireNonNull(apology, "apology must not be null");
            Objects.requireNonNull(pollInterval, "pollInterval must not be null");
            Objects.requireNonNull(publisher, "publisher must not be null");
            Objects.requireNonNull(metrics, "metrics must not be null");
            if (pollInterval.isNegative()) {
                throw new IllegalArgumentException("pollInterval must not be negative: " + pollInterval);
            }
            return new Dispatcher(this);
        }
    }
}
