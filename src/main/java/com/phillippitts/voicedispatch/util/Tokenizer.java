package com.phillippitts.voicedispatch.util;

import com.phillippitts.voicedispatch.domain.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Utility for turning text into tokens and tokens into normalized words.
 *
 * <p>Normalization rules:
 * <ul>
 *   <li>{@link #toLetters(String)} keeps ASCII letters only (used for key-phrase matching)</li>
 *   <li>{@link #toAlphanumeric(String)} keeps ASCII letters and digits, lowercased (used by
 *       services matching command phrases)</li>
 * </ul>
 */
public final class Tokenizer {

    private Tokenizer() {
        // Prevent instantiation
    }

    /**
     * Splits text on whitespace into typed-text tokens.
     *
     * @param text input text (may be null or blank)
     * @return immutable list of tokens, empty if the text has no words
     */
    public static List<Token> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Token> tokens = new ArrayList<>();
        for (String part : text.trim().split("\\s+")) {
            if (!part.isEmpty()) {
                tokens.add(Token.of(part));
            }
        }
        return List.copyOf(tokens);
    }

    /**
     * Removes every character that is not an ASCII letter. Case is preserved.
     *
     * @param word input word (may be null)
     * @return letters only, "" for null
     */
    public static String toLetters(String word) {
        if (word == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(word.length());
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            char lower = Character.toLowerCase(c);
            if (lower >= 'a' && lower <= 'z') {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Lowercases and removes every character that is not an ASCII letter or digit.
     *
     * @param word input word (may be null)
     * @return normalized word, "" for null
     */
    public static String toAlphanumeric(String word) {
        if (word == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(word.length());
        for (char c : word.toLowerCase(Locale.ROOT).toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Normalizes token elements with {@link #toAlphanumeric(String)}, dropping tokens that
     * normalize to nothing (e.g. punctuation).
     *
     * @param tokens tokens to normalize
     * @return immutable list of words
     */
    public static List<String> words(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return List.of();
        }
        List<String> words = new ArrayList<>(tokens.size());
        for (Token t : tokens) {
            String w = toAlphanumeric(t.element());
            if (!w.isEmpty()) {
                words.add(w);
            }
        }
        return List.copyOf(words);
    }

    /**
     * Splits a phrase on whitespace and normalizes each word, dropping empties.
     *
     * @param phrase phrase such as "Copy that"
     * @return immutable list of words
     */
    public static List<String> phraseWords(String phrase) {
        return words(tokenize(phrase));
    }
}
