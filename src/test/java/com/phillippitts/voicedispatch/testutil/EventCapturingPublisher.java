package com.phillippitts.voicedispatch.testutil;

import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records every event the dispatcher or notifier publishes, in order.
 *
 * <p>Safe to read from the test thread while the dispatch loop publishes.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {

    private final List<Object> published = new CopyOnWriteArrayList<>();

    @Override
    public void publishEvent(Object event) {
        published.add(event);
    }

    public <T> List<T> eventsOf(Class<T> type) {
        return published.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }

    public <T> Optional<T> lastOf(Class<T> type) {
        List<T> matching = eventsOf(type);
        return matching.isEmpty() ? Optional.empty() : Optional.of(matching.get(matching.size() - 1));
    }

    public int size() {
        return published.size();
    }

    public void clear() {
        published.clear();
    }
}
