package com.phillippitts.voicedispatch.service.registry;

import com.phillippitts.voicedispatch.service.component.Component;
import com.phillippitts.voicedispatch.service.component.StatusNotifier;

/**
 * Builds one kind of component from its configured arguments.
 */
@FunctionalInterface
public interface ComponentFactory {

    /**
     * @param notifier notifier shared by all components
     * @param args     arguments from configuration
     * @return a new, not yet started component
     * @throws IllegalArgumentException if the arguments are missing or malformed
     */
    Component create(StatusNotifier notifier, ComponentArgs args);
}
