package com.phillippitts.voicedispatch.util;

import com.phillippitts.voicedispatch.domain.Token;

import java.util.List;

/** Utility for privacy-safe logging of utterance and response previews. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * Joins token elements with spaces and truncates the result.
     */
    public static String preview(List<Token> tokens, int max) {
        if (tokens == null || tokens.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(t.element());
            if (sb.length() > max) {
                break;
            }
        }
        return truncate(sb.toString(), max);
    }
}
