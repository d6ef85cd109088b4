package com.doctext.text;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Frequency-ranked keywords. Tokens with equal counts keep the order in which
 * they first appeared in the text.
 */
public class KeywordExtractor {

    public static final int DEFAULT_MIN_TOKEN_LENGTH = 3;

    private final Tokenizer tokenizer;

    public KeywordExtractor() {
        this(new Tokenizer(Stopwords.portuguese(), DEFAULT_MIN_TOKEN_LENGTH));
    }

    public KeywordExtractor(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public List<Keyword> extract(String text, int minFrequency) {
        List<String> tokens = tokenizer.tokens(text);
        if (tokens.isEmpty()) return List.of();

        Map<String, Integer> tally = new LinkedHashMap<>();
        for (String token : tokens) {
            tally.merge(token, 1, Integer::sum);
        }

        List<Keyword> out = new ArrayList<>();
        tally.forEach((token, count) -> {
            if (count >= minFrequency) {
                out.add(new Keyword(token, count));
            }
        });
        // List.sort is stable, so first-seen order survives among ties
        out.sort(Comparator.comparingInt(Keyword::count).reversed());
        return out;
    }
}
