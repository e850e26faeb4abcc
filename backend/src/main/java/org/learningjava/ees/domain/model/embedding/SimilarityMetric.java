package org.learningjava.ees.domain.model.embedding;

import java.util.Arrays;

/** Scoring functions for similarity search. Every metric reports "higher = closer". */
public enum SimilarityMetric {
    COSINE("cosine"),
    EUCLIDEAN("euclidean"),
    DOT_PRODUCT("dot_product");

    private final String tag;

    SimilarityMetric(String tag) {
        this.tag = tag;
    }

    public String tag() { return tag; }

    public static SimilarityMetric fromTag(String tag) {
        if (tag == null || tag.isBlank()) return COSINE;
        return Arrays.stream(values())
                .filter(m -> m.tag.equalsIgnoreCase(tag.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown similarity metric: " + tag));
    }
}
