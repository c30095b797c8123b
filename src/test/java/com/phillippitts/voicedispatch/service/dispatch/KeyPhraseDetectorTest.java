package com.phillippitts.voicedispatch.service.dispatch;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyPhraseDetectorTest {

    private static KeyPhraseDetector detector(String... phrases) {
        return new KeyPhraseDetector(List.of(phrases).stream().map(KeyPhrase::parse).toList());
    }

    @Test
    void offsetPointsJustPastTheMatch() {
        OptionalInt offset = detector("hey dexter")
                .findCommandOffset(List.of("so", "hey", "dexter", "refresh"));

        assertThat(offset).hasValue(3);
    }

    @Test
    void emptyWhenNoPhraseMatches() {
        assertThat(detector("hey dexter").findCommandOffset(List.of("hey", "there"))).isEmpty();
    }

    @Test
    void lastMatchingPhraseInConfigurationOrderWins() {
        List<String> words = List.of("hey", "dexter", "stop");

        assertThat(detector("dexter", "hey").findCommandOffset(words)).hasValue(1);
        assertThat(detector("hey", "dexter").findCommandOffset(words)).hasValue(2);
    }

    @Test
    void laterNonMatchingPhraseDoesNotClearEarlierMatch() {
        assertThat(detector("dexter", "computer").findCommandOffset(List.of("dexter", "go"))).hasValue(1);
    }

    @Test
    void unmatchablePhrasesAreSkipped() {
        assertThat(detector("!!!").findCommandOffset(List.of("", "go"))).isEmpty();
    }

    @Test
    void singleWordSublistIsPlainIndexSearch() {
        assertThat(KeyPhraseDetector.indexOfSublist(List.of("a", "b", "a"), List.of("a"), 0)).isZero();
        assertThat(KeyPhraseDetector.indexOfSublist(List.of("a", "b", "a"), List.of("a"), 1)).isEqualTo(2);
        assertThat(KeyPhraseDetector.indexOfSublist(List.of("a", "b"), List.of("c"), 0)).isEqualTo(-1);
    }

    @Test
    void searchResumesAfterTentativeStartOnMismatch() {
        // First "hey" is followed by "hey", second "hey" is followed by "dexter"
        List<String> words = List.of("hey", "hey", "dexter");

        assertThat(KeyPhraseDetector.indexOfSublist(words, List.of("hey", "dexter"), 0)).isEqualTo(1);
    }

    @Test
    void matchRunningOffTheEndIsNotAMatch() {
        assertThat(KeyPhraseDetector.indexOfSublist(List.of("x", "hey"), List.of("hey", "dexter"), 0))
                .isEqualTo(-1);
    }

    @Test
    void firstOccurrenceIsReturned() {
        List<String> words = List.of("a", "b", "x", "a", "b");

        assertThat(KeyPhraseDetector.indexOfSublist(words, List.of("a", "b"), 0)).isZero();
        assertThat(KeyPhraseDetector.indexOfSublist(words, List.of("a", "b"), 1)).isEqualTo(3);
    }

    @Test
    void emptySublistIsRejected() {
        assertThatThrownBy(() -> KeyPhraseDetector.indexOfSublist(List.of("a"), List.of(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
