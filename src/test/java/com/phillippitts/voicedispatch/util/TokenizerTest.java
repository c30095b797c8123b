package com.phillippitts.voicedispatch.util;

import com.phillippitts.voicedispatch.domain.Token;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizerTest {

    @Test
    void splitsOnAnyWhitespace() {
        List<Token> tokens = Tokenizer.tokenize("  Hey\tDexter \n page  down ");

        assertThat(tokens).extracting(Token::element).containsExactly("Hey", "Dexter", "page", "down");
        assertThat(tokens).allSatisfy(t -> assertThat(t.confidence()).isEqualTo(1.0));
    }

    @Test
    void blankOrNullTextHasNoTokens() {
        assertThat(Tokenizer.tokenize(null)).isEmpty();
        assertThat(Tokenizer.tokenize("   ")).isEmpty();
    }

    @Test
    void toLettersKeepsCaseAndDropsEverythingElse() {
        assertThat(Tokenizer.toLetters("What's-Up2?")).isEqualTo("WhatsUp");
        assertThat(Tokenizer.toLetters("café")).isEqualTo("caf");
        assertThat(Tokenizer.toLetters(null)).isEmpty();
    }

    @Test
    void toAlphanumericLowercasesAndKeepsDigits() {
        assertThat(Tokenizer.toAlphanumeric("What's")).isEqualTo("whats");
        assertThat(Tokenizer.toAlphanumeric("F5!")).isEqualTo("f5");
        assertThat(Tokenizer.toAlphanumeric(null)).isEmpty();
    }

    @Test
    void wordsDropTokensThatNormalizeToNothing() {
        assertThat(Tokenizer.words(Tokenizer.tokenize("What's , the HUMIDITY ?")))
                .containsExactly("whats", "the", "humidity");
        assertThat(Tokenizer.words(null)).isEmpty();
    }

    @Test
    void phraseWordsNormalizeConfiguredPhrases() {
        assertThat(Tokenizer.phraseWords("Open System Monitor")).containsExactly("open", "system", "monitor");
    }
}
