package org.learningjava.ees.domain.model.embedding;

/**
 * Listing filter and paging. Page is 1-based; values below 1 become 1. Limit defaults to
 * {@value #DEFAULT_LIMIT} and never exceeds {@value #MAX_LIMIT}, whatever the caller asks for.
 */
public record EmbeddingFilter(
        String uri,
        String modelName,
        UriMatch uriMatch,
        int page,
        int limit
) {
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public EmbeddingFilter {
        uri = blankToNull(uri);
        modelName = blankToNull(modelName);
        uriMatch = uriMatch == null ? UriMatch.EXACT : uriMatch;
        page = Math.max(page, 1);
        limit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
    }

    public static EmbeddingFilter all() {
        return new EmbeddingFilter(null, null, UriMatch.EXACT, 1, DEFAULT_LIMIT);
    }

    public static EmbeddingFilter byModel(String modelName, int page, int limit) {
        return new EmbeddingFilter(null, modelName, UriMatch.EXACT, page, limit);
    }

    public long offset() {
        return (long) (page - 1) * limit;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
