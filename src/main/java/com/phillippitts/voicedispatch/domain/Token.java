package com.phillippitts.voicedispatch.domain;

import java.util.Objects;

/**
 * Atomic unit of an utterance as delivered by an input.
 *
 * <p>The dispatcher only ever looks at {@link #element()}; confidence and timing are carried
 * through to services untouched.
 *
 * @param element    textual content of the token (must not be null, may be empty)
 * @param confidence recognizer confidence between 0.0 and 1.0 (1.0 for typed text)
 * @param startMs    offset of the token in the utterance in milliseconds, or -1 if unknown
 * @param endMs      end offset in milliseconds, or -1 if unknown
 */
public record Token(
        String element,
        double confidence,
        long startMs,
        long endMs
) {

    public static final long UNKNOWN_TIME = -1L;

    public Token {
        Objects.requireNonNull(element, "Token element must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    /**
     * Creates a token for typed text: full confidence, no timing information.
     *
     * @param element token text
     * @return a new token
     */
    public static Token of(String element) {
        return new Token(element, 1.0, UNKNOWN_TIME, UNKNOWN_TIME);
    }

    @Override
    public String toString() {
        return element;
    }
}
