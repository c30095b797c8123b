package com.phillippitts.voicedispatch.service.dispatch;

import com.phillippitts.voicedispatch.util.Tokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Wake-word sequence that must precede a command, e.g. {@code ("hey", "dexter")}.
 *
 * <p>Words are lowercase and letters only. A configured phrase that sanitizes to nothing
 * (e.g. {@code "!!!"}) yields an empty key-phrase, which never matches.
 *
 * @param source the configured text, kept for logging
 * @param words  sanitized words, immutable
 */
public record KeyPhrase(String source, List<String> words) {

    public KeyPhrase {
        words = words == null ? List.of() : List.copyOf(words);
    }

    /**
     * Parses configured text: split on spaces, strip non-letters, lowercase, drop empties.
     *
     * @param phrase configured key-phrase text
     * @return the sanitized key-phrase
     */
    public static KeyPhrase parse(String phrase) {
        List<String> result = new ArrayList<>();
        if (phrase != null) {
            for (String word : phrase.split(" ")) {
                String letters = Tokenizer.toLetters(word);
                if (!letters.isEmpty()) {
                    result.add(letters.toLowerCase(Locale.ROOT));
                }
            }
        }
        return new KeyPhrase(phrase, result);
    }

    /** @return false if sanitization left no words */
    public boolean isMatchable() {
        return !words.isEmpty();
    }

    public int size() {
        return words.size();
    }

    @Override
    public String toString() {
        return words.toString();
    }
}
