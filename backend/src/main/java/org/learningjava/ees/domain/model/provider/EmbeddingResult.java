package org.learningjava.ees.domain.model.provider;

/** What an adapter returns for one generated embedding. */
public record EmbeddingResult(
        float[] embedding,
        String model,
        String provider,
        Integer tokensUsed
) {
    public int dimensions() {
        return embedding.length;
    }
}
