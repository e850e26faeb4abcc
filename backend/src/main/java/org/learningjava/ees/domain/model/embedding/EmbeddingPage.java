package org.learningjava.ees.domain.model.embedding;

import java.util.List;

public record EmbeddingPage(
        List<EmbeddingRecord> embeddings,
        int page,
        int limit,
        long total,
        int totalPages,
        boolean hasNext,
        boolean hasPrev
) {
    public static EmbeddingPage of(List<EmbeddingRecord> rows, int page, int limit, long total) {
        int totalPages = (int) ((total + limit - 1) / limit);
        return new EmbeddingPage(List.copyOf(rows), page, limit, total, totalPages, page < totalPages, page > 1);
    }

    public int count() {
        return embeddings.size();
    }
}
