package com.doctext.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalized tokens with stopwords and short tokens removed, in text order.
 */
public class Tokenizer {
    private final Stopwords stopwords;
    private final int minLen;

    public Tokenizer(Stopwords stopwords, int minLen) {
        this.stopwords = stopwords;
        this.minLen = minLen;
    }

    public List<String> tokens(String text) {
        String norm = TextNormalizer.normalize(text);
        if (norm.isEmpty()) return List.of();

        String[] parts = norm.split(" ");
        List<String> out = new ArrayList<>(parts.length);
        for (String p : parts) {
            if (p.length() < minLen) continue;
            if (stopwords.contains(p)) continue;
            out.add(p);
        }
        return out;
    }
}
