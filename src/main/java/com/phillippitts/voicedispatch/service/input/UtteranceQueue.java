package com.phillippitts.voicedispatch.service.input;

import com.phillippitts.voicedispatch.domain.Token;
import com.phillippitts.voicedispatch.util.Tokenizer;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Bounded hand-off between the REST layer, which submits typed utterances, and
 * {@link HttpTextInput}, which the dispatcher polls.
 *
 * <p>Thread-safe.
 */
public class UtteranceQueue {

    private final BlockingQueue<List<Token>> queue;
    private final int capacity;

    public UtteranceQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * Tokenizes and enqueues the text.
     *
     * @param text utterance text
     * @return false if the text has no words or the queue is full
     */
    public boolean offer(String text) {
        List<Token> tokens = Tokenizer.tokenize(text);
        if (tokens.isEmpty()) {
            return false;
        }
        return queue.offer(tokens);
    }

    /** @return the oldest pending utterance, or {@code null} if none is pending */
    public List<Token> poll() {
        return queue.poll();
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }
}
