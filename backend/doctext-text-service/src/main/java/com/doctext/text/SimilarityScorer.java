package com.doctext.text;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard similarity over the normalized token sets of two texts.
 */
public final class SimilarityScorer {

    private SimilarityScorer() {
    }

    /**
     * @return a score in {@code [0, 1]}; {@code 0.0} when either side has no tokens
     */
    public static double similarity(String a, String b) {
        Set<String> left = tokenSet(a);
        Set<String> right = tokenSet(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }

        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);

        return (double) intersection.size() / union.size();
    }

    private static Set<String> tokenSet(String text) {
        String norm = TextNormalizer.normalize(text);
        if (norm.isEmpty()) return Set.of();
        return new HashSet<>(Arrays.asList(norm.split(" ")));
    }
}
