package org.learningjava.ees.domain.model.embedding;

import java.time.Instant;

/**
 * One stored embedding. {@code (uri, modelName)} is the natural key; {@code id} is assigned by the
 * store on first save and survives later saves of the same key.
 */
public record EmbeddingRecord(
        Long id,
        String uri,
        String modelName,
        String text,
        float[] embedding,
        Instant createdAt,
        Instant updatedAt
) {
    public int dimensions() {
        return embedding == null ? 0 : embedding.length;
    }
}
