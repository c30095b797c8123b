package com.phillippitts.voicedispatch.service.dispatch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Ties the {@link Dispatcher} to the Spring application lifecycle.
 *
 * <p>On {@link #start()} every component is started on the calling thread, so a component
 * that fails to start aborts application startup. The main loop then runs on the supplied
 * executor. On {@link #stop()} the loop is asked to finish and the call waits, bounded by the
 * shutdown timeout, for every component to be stopped.
 */
public class DispatcherLifecycle implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(DispatcherLifecycle.class);

    private final Dispatcher dispatcher;
    private final Executor executor;
    private final Duration shutdownTimeout;

    private volatile boolean running;

    public DispatcherLifecycle(Dispatcher dispatcher, Executor executor, Duration shutdownTimeout) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        dispatcher.startComponents();
        executor.execute(dispatcher::runLoop);
        running = true;
        LOG.info("Dispatcher started");
    }

    @Override
    public void stop() {
        if (!isRunning()) {
            running = false;
            return;
        }
        dispatcher.requestStop();
        try {
            if (!dispatcher.awaitTermination(shutdownTimeout)) {
                LOG.warn("Dispatcher did not stop within {}ms; a handler may be hung",
                        shutdownTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            LOG.warn("Interrupted while waiting for dispatcher shutdown");
            Thread.currentThread().interrupt();
        }
        running = false;
        LOG.info("Dispatcher stopped");
    }

    /**
     * @return false once the loop has shut down, including when it ended on its own after an
     *         interrupt
     */
    @Override
    public boolean isRunning() {
        return running && !dispatcher.isTerminated();
    }
}
