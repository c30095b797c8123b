package com.phillippitts.voicedispatch.service.keyboard;

import java.awt.event.KeyEvent;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A key combination such as {@code ctrl+shift+c}, resolved to AWT virtual key codes.
 *
 * <p>Keys are pressed in order and released in reverse order.
 *
 * @param text  the chord as configured
 * @param codes virtual key codes in press order
 */
public record KeyChord(String text, List<Integer> codes) {

    private static final Map<String, Integer> NAMED_KEYS = new HashMap<>();

    static {
        NAMED_KEYS.put("ctrl", KeyEvent.VK_CONTROL);
        NAMED_KEYS.put("control", KeyEvent.VK_CONTROL);
        NAMED_KEYS.put("shift", KeyEvent.VK_SHIFT);
        NAMED_KEYS.put("alt", KeyEvent.VK_ALT);
        NAMED_KEYS.put("meta", KeyEvent.VK_META);
        NAMED_KEYS.put("cmd", KeyEvent.VK_META);
        NAMED_KEYS.put("win", KeyEvent.VK_WINDOWS);
        NAMED_KEYS.put("tab", KeyEvent.VK_TAB);
        NAMED_KEYS.put("esc", KeyEvent.VK_ESCAPE);
        NAMED_KEYS.put("escape", KeyEvent.VK_ESCAPE);
        NAMED_KEYS.put("enter", KeyEvent.VK_ENTER);
        NAMED_KEYS.put("space", KeyEvent.VK_SPACE);
        NAMED_KEYS.put("backspace", KeyEvent.VK_BACK_SPACE);
        NAMED_KEYS.put("up", KeyEvent.VK_UP);
        NAMED_KEYS.put("down", KeyEvent.VK_DOWN);
        NAMED_KEYS.put("left", KeyEvent.VK_LEFT);
        NAMED_KEYS.put("right", KeyEvent.VK_RIGHT);
        NAMED_KEYS.put("pageup", KeyEvent.VK_PAGE_UP);
        NAMED_KEYS.put("pagedown", KeyEvent.VK_PAGE_DOWN);
        NAMED_KEYS.put("home", KeyEvent.VK_HOME);
        NAMED_KEYS.put("end", KeyEvent.VK_END);
        NAMED_KEYS.put("`", KeyEvent.VK_BACK_QUOTE);
        for (int i = 1; i <= 12; i++) {
            NAMED_KEYS.put("f" + i, KeyEvent.VK_F1 + i - 1);
        }
    }

    public KeyChord {
        codes = List.copyOf(codes);
    }

    /**
     * Parses a chord written as key names joined by {@code +}, case-insensitive.
     * Single letters and digits map to their own key.
     *
     * @param text chord such as "alt+shift+tab"
     * @return the parsed chord
     * @throws IllegalArgumentException if the chord is blank or names an unknown key
     */
    public static KeyChord parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Key chord must not be blank");
        }
        List<Integer> codes = new ArrayList<>();
        for (String part : text.trim().split("\\+")) {
            String name = part.trim().toLowerCase(Locale.ROOT);
            codes.add(keyCode(name, text));
        }
        return new KeyChord(text, codes);
    }

    private static int keyCode(String name, String text) {
        Integer named = NAMED_KEYS.get(name);
        if (named != null) {
            return named;
        }
        if (name.length() == 1) {
            char c = name.charAt(0);
            if (c >= 'a' && c <= 'z') {
                return KeyEvent.VK_A + (c - 'a');
            }
            if (c >= '0' && c <= '9') {
                return KeyEvent.VK_0 + (c - '0');
            }
        }
        throw new IllegalArgumentException("Unknown key '" + name + "' in chord: " + text);
    }

    /** Presses every key in order, then releases them in reverse order. */
    void press(RobotFacade robot) {
        for (int code : codes) {
            robot.keyPress(code);
        }
        for (int i = codes.size() - 1; i >= 0; i--) {
            robot.keyRelease(codes.get(i));
        }
    }

    @Override
    public String toString() {
        return text;
    }
}
