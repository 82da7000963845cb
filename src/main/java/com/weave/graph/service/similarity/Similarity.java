package com.weave.graph.service.similarity;

import java.util.Set;

/**
 * Similarity measures used for retroactive linking. Both return 0 instead of
 * NaN for empty or zero-magnitude input.
 */
public final class Similarity {

    private Similarity() {
    }

    /**
     * Jaccard coefficient |A ∩ B| / |A ∪ B|.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;

        int intersection = 0;
        for (String token : smaller) {
            if (larger.contains(token)) {
                intersection++;
            }
        }
        int union = a.size() + b.size() - intersection;
        return (double) intersection / union;
    }

    /**
     * Cosine of the angle between two dense vectors, in [-1, 1].
     * Vectors of different length are compared over their common prefix.
     */
    public static double cosine(double[] a, double[] b) {
        if (a == null || b == null || a.length == 0 || b.length == 0) {
            return 0.0;
        }
        int length = Math.min(a.length, b.length);
        double dot = 0;
        double magA = 0;
        double magB = 0;
        for (int i = 0; i < length; i++) {
            dot += a[i] * b[i];
            magA += a[i] * a[i];
            magB += b[i] * b[i];
        }
        double denominator = Math.sqrt(magA) * Math.sqrt(magB);
        return denominator == 0 ? 0.0 : dot / denominator;
    }
}
