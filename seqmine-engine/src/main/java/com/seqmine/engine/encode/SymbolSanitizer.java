package com.seqmine.engine.encode;

import java.util.regex.Pattern;

/**
 * Turns free-text action labels into atomic categorical symbols.
 * 
 * Every run of whitespace becomes a single joiner character, so
 * {@code "click  A"} and {@code "click A"} collide into {@code "click_A"}.
 * Unicode spaces such as U+00A0 count as whitespace.
 * Sanitizing a sanitized symbol returns it unchanged.
 */
public final class SymbolSanitizer {

    public static final char DEFAULT_JOINER = '_';

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final String joiner;

    public SymbolSanitizer() {
        this(DEFAULT_JOINER);
    }

    public SymbolSanitizer(char joiner) {
        if (Character.isWhitespace(joiner)) {
            throw new IllegalArgumentException("Joiner must not be whitespace");
        }
        this.joiner = String.valueOf(joiner);
    }

    public String sanitize(String label) {
        return WHITESPACE_RUN.matcher(label).replaceAll(joiner);
    }
}
