package com.phillippitts.voicedispatch.service.health;

import com.phillippitts.voicedispatch.service.component.Component;
import com.phillippitts.voicedispatch.service.dispatch.Dispatcher;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for the dispatch loop and its components.
 *
 * <ul>
 *   <li>UP: the main loop is polling inputs</li>
 *   <li>DOWN: the loop has not started yet or has stopped</li>
 * </ul>
 *
 * <p>Details list the current status label of every input, output and service.
 * Exposed via /actuator/health endpoint.
 */
@org.springframework.stereotype.Component
public class ComponentHealthIndicator implements HealthIndicator {

    private final Dispatcher dispatcher;

    public ComponentHealthIndicator(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Health health() {
        Health.Builder builder = dispatcher.isLooping() ? Health.up() : Health.down();
        return builder
                .withDetail("loop", dispatcher.isLooping() ? "running" : "stopped")
                .withDetail("inputs", statuses(dispatcher.getInputs()))
                .withDetail("outputs", statuses(dispatcher.getOutputs()))
                .withDetail("services", statuses(dispatcher.getServices()))
                .build();
    }

    private static Map<String, String> statuses(List<? extends Component> components) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < components.size(); i++) {
            Component c = components.get(i);
            String key = out.containsKey(c.getName()) ? c.getName() + "#" + i : c.getName();
            out.put(key, c.getStatus().label());
        }
        return out;
    }
}
