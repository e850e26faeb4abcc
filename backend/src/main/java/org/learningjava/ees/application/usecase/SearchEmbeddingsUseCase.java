package org.learningjava.ees.application.usecase;

import org.learningjava.ees.application.port.EmbeddingStorePort;
import org.learningjava.ees.domain.model.embedding.SimilarEmbedding;
import org.learningjava.ees.domain.model.embedding.SimilarityMetric;
import org.learningjava.ees.domain.model.embedding.SimilarityQuery;
import org.learningjava.ees.domain.model.provider.EmbeddingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class SearchEmbeddingsUseCase {

    private static final Logger log = LoggerFactory.getLogger(SearchEmbeddingsUseCase.class);

    private final EmbeddingProviderFacade provider;
    private final EmbeddingStorePort store;

    public SearchEmbeddingsUseCase(EmbeddingProviderFacade provider, EmbeddingStorePort store) {
        this.provider = provider;
        this.store = store;
    }

    /**
     * Embeds the query text, then ranks stored vectors of the model that produced the query vector.
     *
     * @param threshold minimum similarity, null to keep everything
     */
    public List<SimilarEmbedding> search(String query, String modelName, int limit, Double threshold,
                                         SimilarityMetric metric) {
        CreateEmbeddingUseCase.requireNonBlank(query, "query");

        EmbeddingResult r = provider.generateEmbedding(query, CreateEmbeddingUseCase.blankToNull(modelName));
        List<SimilarEmbedding> hits = store.searchSimilar(
                new SimilarityQuery(r.embedding(), r.model(), limit, threshold, metric));
        log.debug("Search model={} metric={} threshold={} -> {} hits", r.model(), metric, threshold, hits.size());
        return hits;
    }
}
