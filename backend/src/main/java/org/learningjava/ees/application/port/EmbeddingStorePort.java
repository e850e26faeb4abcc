package org.learningjava.ees.application.port;

import org.learningjava.ees.domain.model.embedding.EmbeddingFilter;
import org.learningjava.ees.domain.model.embedding.EmbeddingPage;
import org.learningjava.ees.domain.model.embedding.EmbeddingRecord;
import org.learningjava.ees.domain.model.embedding.SimilarEmbedding;
import org.learningjava.ees.domain.model.embedding.SimilarityQuery;

import java.util.List;
import java.util.Optional;

public interface EmbeddingStorePort {
    void ensureSchema();

    // Writes

    /** Insert or update on (uri, modelName); returns the row id, unchanged for an existing key. */
    long save(String uri, String text, String modelName, float[] embedding);

    boolean updateById(long id, String text, float[] embedding);

    boolean deleteById(long id);

    int deleteAll();

    // Reads
    Optional<EmbeddingRecord> findById(long id);

    Optional<EmbeddingRecord> findByUri(String uri, String modelName);

    EmbeddingPage findAll(EmbeddingFilter filter);

    List<String> listModelNames();

    List<SimilarEmbedding> searchSimilar(SimilarityQuery query);
}
