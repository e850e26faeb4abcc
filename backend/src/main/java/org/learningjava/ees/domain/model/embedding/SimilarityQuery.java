package org.learningjava.ees.domain.model.embedding;

import java.util.Objects;

/**
 * Nearest-neighbour query against one model's vectors.
 *
 * @param threshold minimum similarity to keep, null means no filtering
 */
public record SimilarityQuery(
        float[] queryEmbedding,
        String modelName,
        int limit,
        Double threshold,
        SimilarityMetric metric
) {
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public SimilarityQuery {
        Objects.requireNonNull(queryEmbedding, "queryEmbedding");
        if (queryEmbedding.length == 0) {
            throw new IllegalArgumentException("queryEmbedding must not be empty");
        }
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName is required for similarity search");
        }
        limit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        metric = metric == null ? SimilarityMetric.COSINE : metric;
    }

    public static SimilarityQuery cosine(float[] queryEmbedding, String modelName, int limit) {
        return new SimilarityQuery(queryEmbedding, modelName, limit, null, SimilarityMetric.COSINE);
    }
}
