package com.phillippitts.voicedispatch.exception;

/**
 * Thrown when a submitted utterance cannot be queued because the queue is full.
 */
public class UtteranceRejectedException extends VoiceDispatchException {

    private final int capacity;

    public UtteranceRejectedException(int capacity) {
        super("Utterance queue is full (capacity " + capacity + ")");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
