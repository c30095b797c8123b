package com.phillippitts.voicedispatch.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate(null, 0)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldReturnFullStringWhenNotLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
    }

    @Test
    void shouldTruncateWithEllipsisWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello...");
    }

    @Test
    void previewJoinsTokenElements() {
        assertThat(LogSanitizer.preview(Tokenizer.tokenize("hey dexter refresh"), 100))
                .isEqualTo("hey dexter refresh");
        assertThat(LogSanitizer.preview(Tokenizer.tokenize("hey dexter refresh"), 6))
                .isEqualTo("hey de...");
    }

    @Test
    void previewOfNothingIsEmpty() {
        assertThat(LogSanitizer.preview(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview(java.util.List.of(), 10)).isEmpty();
    }
}
