package com.phillippitts.voicedispatch.service.handler;

/**
 * Outcome of {@link Handler#handle()}.
 *
 * <p>Results are ephemeral: created and consumed within a single dispatch cycle.
 */
public interface Result {

    /** @return response text, or {@code null} if the handler has nothing to say */
    String text();

    /**
     * @return true if no lower-ranked handler may run in the same cycle
     */
    boolean isExclusive();

    /**
     * Non-exclusive result: lower-ranked handlers may append to the response.
     *
     * @param text response text (nullable)
     * @return a new result
     */
    static Result of(String text) {
        return new TextResult(text, false);
    }

    /**
     * Exclusive result: ends handler iteration for the cycle.
     *
     * @param text response text (nullable)
     * @return a new result
     */
    static Result exclusive(String text) {
        return new TextResult(text, true);
    }

    /** Default immutable implementation. */
    record TextResult(String text, boolean exclusive) implements Result {
        @Override
        public boolean isExclusive() {
            return exclusive;
        }
    }
}
