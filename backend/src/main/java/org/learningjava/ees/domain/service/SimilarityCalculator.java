package org.learningjava.ees.domain.service;

import org.learningjava.ees.domain.model.embedding.SimilarityMetric;

/**
 * Vector scoring for similarity search. Every metric is expressed as a similarity so that
 * "higher = closer" holds for all of them.
 */
public final class SimilarityCalculator {

    /**
     * Cosine similarity in [-1, 1]. A zero vector has no direction and scores 0 against anything.
     */
    public static double cosine(float[] a, float[] b) {
        requireSameLength(a, b);
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) return 0.0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    public static double euclideanDistance(float[] a, float[] b) {
        requireSameLength(a, b);
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = (double) a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    /** 1 / (1 + distance): 1.0 for identical vectors, towards 0 as they move apart. */
    public static double euclideanSimilarity(float[] a, float[] b) {
        return 1.0 / (1.0 + euclideanDistance(a, b));
    }

    public static double dotProduct(float[] a, float[] b) {
        requireSameLength(a, b);
        double dot = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return dot;
    }

    public static double score(SimilarityMetric metric, float[] query, float[] candidate) {
        return switch (metric) {
            case COSINE -> cosine(query, candidate);
            case EUCLIDEAN -> euclideanSimilarity(query, candidate);
            case DOT_PRODUCT -> dotProduct(query, candidate);
        };
    }

    private static void requireSameLength(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimensions must match: " + a.length + " vs " + b.length);
        }
    }

    private SimilarityCalculator() {}
}
