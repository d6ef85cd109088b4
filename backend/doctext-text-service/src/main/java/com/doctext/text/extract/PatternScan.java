package com.doctext.text.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered list of patterns scanned one after another over the same text.
 * Matches are reported pattern by pattern, left to right within a pattern.
 * A match overlapping a span already reported by an earlier pattern is
 * skipped; equal values at different positions are all kept.
 */
final class PatternScan {

    private final List<Pattern> patterns;

    private PatternScan(List<Pattern> patterns) {
        this.patterns = patterns;
    }

    static PatternScan of(Pattern... patterns) {
        return new PatternScan(List.of(patterns));
    }

    List<String> findAll(String text) {
        List<String> out = new ArrayList<>();
        List<int[]> claimed = new ArrayList<>();
        for (Pattern pattern : patterns) {
            List<int[]> spans = new ArrayList<>();
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                if (overlapsAny(claimed, m.start(), m.end())) continue;
                out.add(m.group());
                spans.add(new int[] {m.start(), m.end()});
            }
            claimed.addAll(spans);
        }
        return out;
    }

    boolean matchesWhole(String value) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(value).matches()) return true;
        }
        return false;
    }

    private static boolean overlapsAny(List<int[]> claimed, int start, int end) {
        for (int[] span : claimed) {
            if (start < span[1] && span[0] < end) return true;
        }
        return false;
    }
}
