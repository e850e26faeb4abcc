package org.learningjava.ees.domain.model.embedding;

import java.time.Instant;

/** One ranked hit of a similarity search. */
public record SimilarEmbedding(
        long id,
        String uri,
        String text,
        String modelName,
        double similarity,
        Instant createdAt,
        Instant updatedAt
) {}
