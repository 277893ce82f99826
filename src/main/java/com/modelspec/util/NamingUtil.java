package com.modelspec.util;

import java.util.Collection;
import java.util.Optional;

/**
 * Helpers for argument names shown back to users.
 */
public class NamingUtil {

    private static final int MAX_SUGGESTION_DISTANCE = 3;

    private NamingUtil() {
        // Utility class
    }

    /**
     * Closest candidate to {@code name} by edit distance, if any is close enough to be a
     * plausible typo.
     */
    public static Optional<String> closest(String name, Collection<String> candidates) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            int d = editDistance(name, candidate);
            if (d < bestDistance) {
                best = candidate;
                bestDistance = d;
            }
        }
        int limit = Math.min(MAX_SUGGESTION_DISTANCE, Math.max(1, name.length() / 2));
        return bestDistance <= limit ? Optional.ofNullable(best) : Optional.empty();
    }

    /**
     * " Did you mean 'x'?" for the closest candidate, or an empty string.
     */
    public static String didYouMean(String name, Collection<String> candidates) {
        return closest(name, candidates)
                .map(c -> " Did you mean '" + c + "'?")
                .orElse("");
    }

    /**
     * Levenshtein distance.
     */
    public static int editDistance(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    /**
     * Column name for a prediction of one outcome level, e.g. ".pred_setosa".
     */
    public static String predictionColumn(String prefix, String level) {
        return prefix + level;
    }
}
