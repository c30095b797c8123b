package com.phillippitts.voicedispatch.service.dispatch;

import java.util.List;
import java.util.OptionalInt;

/**
 * Finds configured key-phrases in a word sequence using exact, ordered sublist search.
 *
 * <p>Every configured phrase is searched, in configuration order, and the offset of the
 * <em>last</em> phrase that matched is returned. This mirrors long-standing behaviour; it is
 * not a priority scheme, so configure phrases that cannot both appear in one utterance.
 */
public final class KeyPhraseDetector {

    private final List<KeyPhrase> keyPhrases;

    public KeyPhraseDetector(List<KeyPhrase> keyPhrases) {
        this.keyPhrases = keyPhrases == null ? List.of() : List.copyOf(keyPhrases);
    }

    public List<KeyPhrase> getKeyPhrases() {
        return keyPhrases;
    }

    /**
     * Locates the start of the command that follows a key-phrase.
     *
     * @param words lowercase letters-only projection of each token, one entry per token
     * @return index just past the matched key-phrase, or empty if no key-phrase is present
     */
    public OptionalInt findCommandOffset(List<String> words) {
        OptionalInt offset = OptionalInt.empty();
        for (KeyPhrase phrase : keyPhrases) {
            if (!phrase.isMatchable()) {
                continue;
            }
            int index = indexOfSublist(words, phrase.words(), 0);
            if (index >= 0) {
                offset = OptionalInt.of(index + phrase.size());
            }
        }
        return offset;
    }

    /**
     * Finds the first contiguous occurrence of {@code sublist} in {@code list} at or after
     * {@code start}.
     *
     * <p>A single-element sublist is a plain index search. Otherwise each occurrence of the
     * first element is tried in turn, checking that the rest follows immediately; on a
     * mismatch the search resumes just after that tentative start.
     *
     * @param list    list to search
     * @param sublist non-empty list to look for
     * @param start   first index to consider
     * @return index of the match, or -1 if there is none
     * @throws IllegalArgumentException if sublist is empty
     */
    static int indexOfSublist(List<String> list, List<String> sublist, int start) {
        if (sublist.isEmpty()) {
            throw new IllegalArgumentException("Empty sublist is never in a list");
        }
        if (sublist.size() == 1) {
            return indexOf(list, sublist.get(0), start);
        }
        int offset = start;
        while (true) {
            int first = indexOf(list, sublist.get(0), offset);
            if (first < 0 || first + sublist.size() > list.size()) {
                return -1;
            }
            if (followsAt(list, sublist, first)) {
                return first;
            }
            offset = first + 1;
        }
    }

    private static int indexOf(List<String> list, String element, int start) {
        for (int i = Math.max(start, 0); i < list.size(); i++) {
            if (element.equals(list.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean followsAt(List<String> list, List<String> sublist, int first) {
        for (int i = 1; i < sublist.size(); i++) {
            if (!sublist.get(i).equals(list.get(first + i))) {
                return false;
            }
        }
        return true;
    }
}
