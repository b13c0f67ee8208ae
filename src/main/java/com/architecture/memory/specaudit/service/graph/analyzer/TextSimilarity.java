package com.architecture.memory.specaudit.service.graph.analyzer;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Token-based similarity shared by the duplicate, overlap and gap heuristics.
 */
public final class TextSimilarity {

    private static final Pattern SPLIT = Pattern.compile("[^a-z0-9]+");
    private static final Pattern CAMEL = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "of", "to", "in", "on", "for", "and", "or", "is", "are", "be",
            "by", "with", "that", "this", "it", "as", "at", "from", "which", "its");

    private TextSimilarity() {
    }

    public static Set<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        String spaced = CAMEL.matcher(text).replaceAll(" ").toLowerCase(Locale.ROOT);
        Set<String> tokens = new TreeSet<>();
        for (String token : SPLIT.split(spaced)) {
            if (!token.isEmpty() && !STOP_WORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    public static double jaccard(String a, String b) {
        return jaccard(tokens(a), tokens(b));
    }

    public static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
