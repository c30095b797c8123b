package com.phillippitts.voicedispatch.exception;

/**
 * Thrown when a configured component cannot be built: unknown kind, missing or malformed
 * arguments, or a kind used in the wrong role (e.g. an output listed under inputs).
 */
public class ComponentConfigurationException extends VoiceDispatchException {

    private final String kind;

    public ComponentConfigurationException(String kind, String message) {
        super(message + " (kind: " + kind + ")");
        this.kind = kind;
    }

    public ComponentConfigurationException(String kind, String message, Throwable cause) {
        super(message + " (kind: " + kind + ")", cause);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
