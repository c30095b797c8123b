package com.phillippitts.voicedispatch.exception;

/**
 * Thrown when a component fails to start. Startup failures are fatal: the dispatcher
 * never runs with a partially started set of components.
 */
public class ComponentStartupException extends VoiceDispatchException {

    private final String componentName;

    public ComponentStartupException(String componentName, Throwable cause) {
        super("Failed to start component " + componentName + ": " + cause.getMessage(), cause);
        this.componentName = componentName;
    }

    public String getComponentName() {
        return componentName;
    }
}
