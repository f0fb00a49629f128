package com.ledgerradar.common;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Jaccard coefficient over lowercase character bigrams, scaled to 0..100.
 */
public final class BigramSimilarity {

    private BigramSimilarity() {
    }

    public static double similarity(String a, String b) {
        String left = a == null ? "" : a.toLowerCase(Locale.ROOT);
        String right = b == null ? "" : b.toLowerCase(Locale.ROOT);
        Set<String> leftBigrams = bigrams(left);
        Set<String> rightBigrams = bigrams(right);
        if (leftBigrams.isEmpty() && rightBigrams.isEmpty()) {
            // strings shorter than two characters have no bigrams
            return left.equals(right) ? 100.0 : 0.0;
        }
        Set<String> intersection = new HashSet<>(leftBigrams);
        intersection.retainAll(rightBigrams);
        Set<String> union = new HashSet<>(leftBigrams);
        union.addAll(rightBigrams);
        return intersection.size() * 100.0 / union.size();
    }

    static Set<String> bigrams(String s) {
        Set<String> result = new HashSet<>();
        for (int i = 0; i + 1 < s.length(); i++) {
            result.add(s.substring(i, i + 2));
        }
        return result;
    }
}
