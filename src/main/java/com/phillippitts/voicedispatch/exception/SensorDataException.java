package com.phillippitts.voicedispatch.exception;

/**
 * Thrown when sensor readings cannot be fetched or parsed.
 */
public class SensorDataException extends VoiceDispatchException {

    private final long sensorId;

    public SensorDataException(long sensorId, String message, Throwable cause) {
        super(message + " (sensor: " + sensorId + ")", cause);
        this.sensorId = sensorId;
    }

    public long getSensorId() {
        return sensorId;
    }
}
