package org.learningjava.ees.domain.model.batch;

import org.learningjava.ees.domain.model.embedding.SavedEmbedding;

/** Per-item outcome. Exactly one of {@code saved} / {@code error} is set. */
public record BatchItemResult(String uri, SavedEmbedding saved, String error) {

    public static BatchItemResult success(SavedEmbedding saved) {
        return new BatchItemResult(saved.uri(), saved, null);
    }

    public static BatchItemResult failure(String uri, String error) {
        return new BatchItemResult(uri, null, error == null ? "Unknown error" : error);
    }

    public boolean success() {
        return saved != null;
    }
}
