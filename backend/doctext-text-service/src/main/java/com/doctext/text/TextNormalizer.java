package com.doctext.text;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical token form shared by similarity scoring and keyword extraction.
 * Output holds only {@code [a-z0-9]} runs separated by single spaces.
 */
public final class TextNormalizer {

    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_TOKEN = Pattern.compile("[^a-z0-9]+");

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";
        String norm = Normalizer.normalize(text, Normalizer.Form.NFD);
        norm = MARKS.matcher(norm).replaceAll("").toLowerCase(Locale.ROOT);

        // anything outside letters/digits, whitespace included, becomes one space
        return NON_TOKEN.matcher(norm).replaceAll(" ").strip();
    }
}
