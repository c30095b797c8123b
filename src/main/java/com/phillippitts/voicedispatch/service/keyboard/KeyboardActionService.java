package com.phillippitts.voicedispatch.service.keyboard;

import com.phillippitts.voicedispatch.domain.Status;
import com.phillippitts.voicedispatch.domain.Token;
import com.phillippitts.voicedispatch.exception.VoiceDispatchException;
import com.phillippitts.voicedispatch.service.component.AbstractComponent;
import com.phillippitts.voicedispatch.service.component.StatusNotifier;
import com.phillippitts.voicedispatch.service.handler.AbstractHandler;
import com.phillippitts.voicedispatch.service.handler.Handler;
import com.phillippitts.voicedispatch.service.handler.Result;
import com.phillippitts.voicedispatch.service.handler.Service;
import com.phillippitts.voicedispatch.util.Tokenizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns spoken phrases such as "copy that" or "next window" into key chords.
 *
 * <p>A phrase applies when the command starts with its words. Phrases are tried in table
 * order and the first match wins. The chord is pressed when the handler runs, so a
 * higher-ranked exclusive result suppresses it. The result carries no text and is not
 * exclusive.
 *
 * <p>Requires a display and permission to synthesize input; {@link #start()} fails otherwise.
 */
public class KeyboardActionService extends AbstractComponent implements Service {

    private static final Logger LOG = LogManager.getLogger(KeyboardActionService.class);

    /** Default belief for keyboard handlers. */
    public static final double DEFAULT_BELIEF = 0.8;

    private static final Map<String, String> DEFAULT_ACTIONS = defaultActions();

    private final double belief;
    private final Map<List<String>, KeyChord> actions;
    private final RobotFacade.Provider robotProvider;
    private volatile RobotFacade robot;

    public KeyboardActionService(StatusNotifier notifier, double belief) {
        this(notifier, belief, DEFAULT_ACTIONS, KeyboardActionService::awtRobot);
    }

    // Package-private for tests
    KeyboardActionService(StatusNotifier notifier, double belief, Map<String, String> phraseToChord,
                          RobotFacade.Provider robotProvider) {
        super(notifier);
        this.belief = belief;
        this.robotProvider = Objects.requireNonNull(robotProvider, "robotProvider must not be null");
        Map<List<String>, KeyChord> parsed = new LinkedHashMap<>();
        phraseToChord.forEach((phrase, chord) -> {
            List<String> words = Tokenizer.phraseWords(phrase);
            if (words.isEmpty()) {
                throw new IllegalArgumentException("Keyboard phrase has no words: '" + phrase + "'");
            }
            parsed.put(words, KeyChord.parse(chord));
        });
        this.actions = Collections.unmodifiableMap(parsed);
    }

    private static RobotFacade awtRobot() throws AWTException {
        if (GraphicsEnvironment.isHeadless()) {
            throw new AWTException("Headless environment; keyboard actions need a display");
        }
        return new RobotFacade.AwtRobotFacade();
    }

    @Override
    protected void doStart() {
        try {
            robot = robotProvider.create();
        } catch (AWTException e) {
            throw new VoiceDispatchException("Cannot synthesize key events: " + e.getMessage(), e);
        }
        LOG.info("Keyboard actions ready ({} phrases, belief={})", actions.size(), belief);
    }

    @Override
    public Handler evaluate(List<Token> tokens) {
        List<String> words = Tokenizer.words(tokens);
        for (Map.Entry<List<String>, KeyChord> action : actions.entrySet()) {
            List<String> phrase = action.getKey();
            if (words.size() >= phrase.size() && words.subList(0, phrase.size()).equals(phrase)) {
                return new KeyboardActionHandler(this, tokens, belief, action.getValue());
            }
        }
        return null;
    }

    public Map<List<String>, KeyChord> getActions() {
        return actions;
    }

    private void press(KeyChord chord) {
        RobotFacade r = robot;
        if (r == null) {
            throw new IllegalStateException("KeyboardActionService has not been started");
        }
        notifyStatus(Status.WORKING);
        try {
            LOG.info("Pressing {}", chord);
            chord.press(r);
        } finally {
            notifyStatus(Status.IDLE);
        }
    }

    private static Map<String, String> defaultActions() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("Copy that", "ctrl+c");
        m.put("Paste that", "ctrl+v");
        m.put("Copy from terminal", "ctrl+shift+c");
        m.put("Paste to terminal", "ctrl+shift+v");
        m.put("Refresh", "f5");
        m.put("Open terminal", "ctrl+alt+t");
        m.put("Show applications", "win");
        m.put("Show notifications", "win+m");
        m.put("Open System Monitor", "win+2");
        m.put("Open Firefox", "win+3");
        m.put("Open Chrome", "win+6");
        m.put("Open Thunderbird", "win+7");
        m.put("Open Code", "win+8");
        m.put("Open Signal", "win+9");
        m.put("Open Slack", "ctrl+alt+shift+s");
        m.put("Next application", "alt+tab");
        m.put("Last application", "alt+shift+tab");
        m.put("Next window", "alt+`");
        m.put("Last window", "alt+shift+`");
        m.put("Press escape key", "esc");
        m.put("Move up", "up");
        m.put("Move down", "down");
        m.put("Page up", "pageup");
        m.put("Page down", "pagedown");
        return Collections.unmodifiableMap(m);
    }

    private static final class KeyboardActionHandler extends AbstractHandler {
        private final KeyChord chord;

        KeyboardActionHandler(KeyboardActionService service, List<Token> tokens, double belief, KeyChord chord) {
            super(service, tokens, belief);
            this.chord = chord;
        }

        @Override
        public Result handle() {
            ((KeyboardActionService) service()).press(chord);
            return Result.of(null);
        }

        @Override
        public String toString() {
            return "KeyboardActionHandler[chord=" + chord + ", belief=" + belief() + "]";
        }
    }
}
