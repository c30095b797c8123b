package com.phillippitts.voicedispatch.service.input;

import com.phillippitts.voicedispatch.domain.Token;
import com.phillippitts.voicedispatch.service.component.AbstractComponent;
import com.phillippitts.voicedispatch.service.component.Input;
import com.phillippitts.voicedispatch.service.component.StatusNotifier;
import com.phillippitts.voicedispatch.util.Tokenizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Reads one line per poll from a character stream (standard input by default).
 *
 * <p>Never blocks: only characters the stream reports as {@link Reader#ready() ready} are
 * consumed, and they accumulate until a newline completes the line. A partially typed line is
 * therefore kept across polls. Blank lines yield nothing. End of stream is reported once, any
 * unterminated last line is still delivered, and the input goes quiet afterwards.
 */
public class ConsoleTextInput extends AbstractComponent implements Input {

    private static final Logger LOG = LogManager.getLogger(ConsoleTextInput.class);

    private final BufferedReader reader;
    private final StringBuilder pending = new StringBuilder();
    private boolean exhausted;

    public ConsoleTextInput(StatusNotifier notifier) {
        this(notifier, new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }

    // Package-private for tests
    ConsoleTextInput(StatusNotifier notifier, Reader source) {
        super(notifier);
        this.reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
    }

    /**
     * @throws UncheckedIOException if the stream fails
     */
    @Override
    public synchronized List<Token> read() {
        if (exhausted || isStopped()) {
            return null;
        }
        try {
            while (reader.ready()) {
                int c = reader.read();
                if (c == -1) {
                    LOG.info("End of console input");
                    exhausted = true;
                    return takeLine();
                }
                if (c == '\n') {
                    return takeLine();
                }
                pending.append((char) c);
            }
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read console input", e);
        }
    }

    private List<Token> takeLine() {
        int end = pending.length();
        if (end > 0 && pending.charAt(end - 1) == '\r') {
            end--;
        }
        String line = pending.substring(0, end);
        pending.setLength(0);
        List<Token> tokens = Tokenizer.tokenize(line);
        return tokens.isEmpty() ? null : tokens;
    }
}
