package com.phillippitts.voicedispatch.service.notifier;

import com.phillippitts.voicedispatch.domain.Status;
import com.phillippitts.voicedispatch.service.component.Component;
import com.phillippitts.voicedispatch.service.component.StatusNotifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main notifier: logs every transition, publishes a {@link ComponentStatusChangedEvent} and
 * keeps the latest status of each component for health checks and the status endpoint.
 *
 * <p>It also tracks, per {@link ComponentGroup}, which components are currently busy and since
 * when the group has been busy. An activity indicator (LED, tray icon) can poll
 * {@link #busySince(ComponentGroup)} from its own thread.
 *
 * <p>Thread-safe. {@link #update(Component, Status)} never throws.
 */
public class TrackingStatusNotifier implements StatusNotifier {

    private static final Logger LOG = LogManager.getLogger(TrackingStatusNotifier.class);

    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    // Keyed by identity: several components of the same type share a name
    private final Map<Component, ComponentSnapshot> latest = new ConcurrentHashMap<>();
    private final Map<ComponentGroup, Set<Component>> busy = new EnumMap<>(ComponentGroup.class);
    private final Map<ComponentGroup, Instant> busySince = new EnumMap<>(ComponentGroup.class);

    public TrackingStatusNotifier(ApplicationEventPublisher publisher) {
        this(publisher, Clock.systemUTC());
    }

    // Package-private for tests
    TrackingStatusNotifier(ApplicationEventPublisher publisher, Clock clock) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (ComponentGroup g : ComponentGroup.values()) {
            busy.put(g, ConcurrentHashMap.newKeySet());
        }
    }

    @Override
    public void update(Component component, Status status) {
        if (component == null || status == null) {
            return;
        }
        try {
            LOG.info("Component {} is now {}", component.getName(), status.label());
            Instant now = clock.instant();
            ComponentGroup group = ComponentGroup.of(component);
            latest.put(component, new ComponentSnapshot(component.getName(), group, status, now));
            trackActivity(component, group, status, now);
            publisher.publishEvent(new ComponentStatusChangedEvent(component.getName(), group, status, now));
        } catch (RuntimeException e) {
            LOG.warn("Failed to record status {} for {}: {}", status, component.getName(), e.toString());
        }
    }

    private void trackActivity(Component component, ComponentGroup group, Status status, Instant now) {
        Set<Component> members = busy.get(group);
        synchronized (members) {
            if (status.isBusy()) {
                members.add(component);
                busySince.put(group, now);
            } else {
                members.remove(component);
                if (members.isEmpty()) {
                    busySince.remove(group);
                }
            }
        }
    }

    /**
     * @return time of the most recent transition to a busy status in the group, or empty if
     *         every component of the group is idle
     */
    public Optional<Instant> busySince(ComponentGroup group) {
        Set<Component> members = busy.get(group);
        synchronized (members) {
            return Optional.ofNullable(busySince.get(group));
        }
    }

    public boolean isBusy(ComponentGroup group) {
        return !busy.get(group).isEmpty();
    }

    /** @return latest status of every component seen so far */
    public List<ComponentSnapshot> snapshot() {
        return new ArrayList<>(latest.values());
    }
}
