package com.phillippitts.voicedispatch.exception;

/**
 * Base exception for all voiceDispatch application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VoiceDispatchException extends RuntimeException {

    public VoiceDispatchException(String message) {
        super(message);
    }

    public VoiceDispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceDispatchException(Throwable cause) {
        super(cause);
    }
}
