package com.phillippitts.voicedispatch.service.component;

import com.phillippitts.voicedispatch.domain.Status;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Base class for components providing the status model and a guarded start/stop lifecycle.
 *
 * <p>This class implements the Template Method pattern: {@link #start()} and {@link #stop()}
 * are final and delegate to {@link #doStart()} and {@link #doStop()}.
 *
 * <p><b>Status:</b> every component begins in {@link Status#INITIALIZING} and moves to
 * {@link Status#IDLE} once started. Subclasses report further transitions through
 * {@link #notifyStatus(Status)}; the status is only ever mutated by the component itself.
 *
 * <p><b>Idempotency:</b> both {@code start()} and {@code stop()} run their hook at most once.
 * Once stopped, no further transitions are reported.
 *
 * <p><b>Thread Safety:</b> lifecycle methods synchronize on an internal lock. The status field
 * is volatile so observers on other threads (health checks) see the latest value.
 *
 * @since 1.0
 */
public abstract class AbstractComponent implements Component {

    private static final Logger LOG = LogManager.getLogger(AbstractComponent.class);

    private final Object lock = new Object();
    private final StatusNotifier notifier;

    private volatile Status status = Status.INITIALIZING;
    private boolean started;
    private volatile boolean stopped;

    /**
     * @param notifier notifier shared by all components (outlives this component)
     * @throws NullPointerException if notifier is null
     */
    protected AbstractComponent(StatusNotifier notifier) {
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
    }

    @Override
    public final void start() {
        synchronized (lock) {
            if (started || stopped) {
                return;
            }
            doStart();
            started = true;
        }
        notifyStatus(Status.IDLE);
    }

    /**
     * Component-specific setup, e.g. opening a connection or checking a device.
     * Exceptions propagate to the dispatcher and abort startup.
     */
    protected void doStart() {
    }

    @Override
    public final void stop() {
        synchronized (lock) {
            if (stopped) {
                return;
            }
            stopped = true;
            doStop();
        }
    }

    /**
     * Component-specific cleanup. May throw; the dispatcher logs and carries on stopping
     * the remaining components.
     */
    protected void doStop() {
    }

    /**
     * Reports a status change to the notifier. Repeated reports of the current status and
     * reports after {@link #stop()} are ignored.
     *
     * @param newStatus the new status
     */
    protected final void notifyStatus(Status newStatus) {
        if (stopped || newStatus == null || newStatus == status) {
            return;
        }
        status = newStatus;
        try {
            notifier.update(this, newStatus);
        } catch (RuntimeException e) {
            LOG.warn("Notifier failed for {} -> {}: {}", getName(), newStatus, e.toString());
        }
    }

    @Override
    public Status getStatus() {
        return status;
    }

    /** @return true once {@link #stop()} has been called */
    protected final boolean isStopped() {
        return stopped;
    }

    @Override
    public String getName() {
        return getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return getName();
    }
}
