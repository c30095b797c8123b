package com.phillippitts.voicedispatch.service.component;

/**
 * Sink for responses (speech, display, log, clipboard).
 */
public interface Output extends Component {

    /**
     * Delivers a response to the user. May throw; the dispatcher isolates failures so the
     * remaining outputs still receive the text.
     *
     * @param text non-empty response text
     */
    void write(String text);
}
