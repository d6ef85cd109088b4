package com.doctext.text;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Display helpers and simple counts. Lengths are measured in code points.
 */
public final class TextMetrics {

    public static final String ELLIPSIS = "...";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextMetrics() {
    }

    /**
     * Returns the text unchanged when it fits, otherwise the first
     * {@code maxLength - 3} code points followed by {@value #ELLIPSIS}.
     * With {@code maxLength < 3} only the ellipsis is returned.
     */
    public static String truncateForDisplay(String text, int maxLength) {
        if (text == null || text.isEmpty()) return "";
        int length = text.codePointCount(0, text.length());
        if (length <= maxLength) {
            return text;
        }
        int keep = Math.max(0, maxLength - ELLIPSIS.length());
        return text.substring(0, text.offsetByCodePoints(0, keep)) + ELLIPSIS;
    }

    public static int wordCount(String text) {
        return words(text).length;
    }

    public static int charCount(String text, boolean includeSpaces) {
        if (text == null || text.isEmpty()) return 0;
        String counted = includeSpaces ? text : text.replace(" ", "");
        return counted.codePointCount(0, counted.length());
    }

    /**
     * The first {@code maxWords} words joined by single spaces plus an
     * ellipsis. Text that is already short enough comes back untouched, its
     * original spacing included.
     */
    public static String summarize(String text, int maxWords) {
        if (text == null || text.isEmpty()) return "";
        String[] words = words(text);
        if (words.length <= maxWords) {
            return text;
        }
        return String.join(" ", Arrays.copyOf(words, Math.max(0, maxWords))) + ELLIPSIS;
    }

    private static String[] words(String text) {
        if (text == null || text.isEmpty()) return new String[0];
        return WHITESPACE.splitAsStream(text)
            .filter(w -> !w.isEmpty())
            .toArray(String[]::new);
    }
}
