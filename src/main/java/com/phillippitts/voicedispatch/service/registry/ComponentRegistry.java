package com.phillippitts.voicedispatch.service.registry;

import com.phillippitts.voicedispatch.exception.ComponentConfigurationException;
import com.phillippitts.voicedispatch.service.component.Component;
import com.phillippitts.voicedispatch.service.component.StatusNotifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps component kind identifiers (e.g. {@code "http-text"}, {@code "purpleair"}) to the
 * factories that build them.
 *
 * <p>Kinds are registered once while the application context is built; configuration then
 * refers to components by kind. Nothing is loaded reflectively.
 */
public final class ComponentRegistry {

    private static final Logger LOG = LogManager.getLogger(ComponentRegistry.class);

    private final Map<String, ComponentFactory> factories = new LinkedHashMap<>();

    /**
     * Registers a factory, replacing any factory registered for the same kind.
     *
     * @return this registry
     */
    public ComponentRegistry register(String kind, ComponentFactory factory) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        if (factories.put(kind, factory) != null) {
            LOG.warn("Component kind '{}' registered twice; keeping the latest factory", kind);
        }
        return this;
    }

    public boolean contains(String kind) {
        return factories.containsKey(kind);
    }

    public Set<String> kinds() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    /**
     * Builds a component of the given kind and checks that it fulfils the expected role.
     *
     * @param kind     registered kind identifier
     * @param args     configured arguments
     * @param notifier notifier shared by all components
     * @param role     expected capability, e.g. {@code Input.class}
     * @return the new component
     * @throws ComponentConfigurationException if the kind is unknown, the factory rejects the
     *                                         arguments, or the component has the wrong role
     */
    public <T extends Component> T create(String kind, ComponentArgs args, StatusNotifier notifier,
                                          Class<T> role) {
        ComponentFactory factory = factories.get(kind);
        if (factory == null) {
            throw new ComponentConfigurationException(kind, "Unknown component kind; known kinds are " + kinds());
        }
        Component component;
        try {
            component = factory.create(notifier, args == null ? ComponentArgs.empty() : args);
        } catch (RuntimeException e) {
            throw new ComponentConfigurationException(kind,
                    "Failed to create component with args " + args + ": " + e.getMessage(), e);
        }
        if (!role.isInstance(component)) {
            throw new ComponentConfigurationException(kind,
                    component.getName() + " is not a " + role.getSimpleName());
        }
        LOG.debug("Created {} for kind '{}'", component, kind);
        return role.cast(component);
    }
}
