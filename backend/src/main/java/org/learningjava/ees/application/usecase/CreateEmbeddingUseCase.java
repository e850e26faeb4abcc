package org.learningjava.ees.application.usecase;

import org.learningjava.ees.application.port.EmbeddingStorePort;
import org.learningjava.ees.domain.model.embedding.EmbeddingRecord;
import org.learningjava.ees.domain.model.embedding.SavedEmbedding;
import org.learningjava.ees.domain.model.provider.EmbeddingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class CreateEmbeddingUseCase {

    private static final Logger log = LoggerFactory.getLogger(CreateEmbeddingUseCase.class);

    private final EmbeddingProviderFacade provider;
    private final EmbeddingStorePort store;

    public CreateEmbeddingUseCase(EmbeddingProviderFacade provider, EmbeddingStorePort store) {
        this.provider = provider;
        this.store = store;
    }

    /**
     * Embeds {@code text} with the current provider and stores it under the model that produced the
     * vector. Saving the same uri and model again replaces text and vector and keeps the id.
     *
     * @param modelName null or blank for the provider's default
     */
    public SavedEmbedding create(String uri, String text, String modelName) {
        requireNonBlank(uri, "uri");
        requireNonBlank(text, "text");

        EmbeddingResult r = provider.generateEmbedding(text, blankToNull(modelName));
        long id = store.save(uri, text, r.model(), r.embedding());
        log.debug("Created embedding id={} uri={} model={} dim={}", id, uri, r.model(), r.dimensions());
        return new SavedEmbedding(id, uri, r.model());
    }

    /** Re-embeds with the record's own model. Empty when the id does not exist. */
    public Optional<SavedEmbedding> update(long id, String text) {
        requireNonBlank(text, "text");
        Optional<EmbeddingRecord> existing = store.findById(id);
        if (existing.isEmpty()) return Optional.empty();

        EmbeddingRecord rec = existing.get();
        EmbeddingResult r = provider.generateEmbedding(text, rec.modelName());
        if (!store.updateById(id, text, r.embedding())) {
            // deleted between the read and the write
            return Optional.empty();
        }
        return Optional.of(new SavedEmbedding(id, rec.uri(), rec.modelName()));
    }

    static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }

    static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
