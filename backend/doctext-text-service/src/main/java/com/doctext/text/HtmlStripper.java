package com.doctext.text;

import java.util.regex.Pattern;

/**
 * Drops markup from extracted text. Tags are matched up to the first {@code >},
 * so a {@code >} inside an attribute value ends the tag early. Entities are
 * removed, not decoded.
 */
public final class HtmlStripper {

    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern NAMED_ENTITY = Pattern.compile("&[a-zA-Z]+;");
    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#\\d+;");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private HtmlStripper() {
    }

    public static String strip(String text) {
        if (text == null || text.isEmpty()) return "";
        String out = TAG.matcher(text).replaceAll("");
        out = NAMED_ENTITY.matcher(out).replaceAll("");
        out = NUMERIC_ENTITY.matcher(out).replaceAll("");
        return WHITESPACE.matcher(out).replaceAll(" ").strip();
    }
}
