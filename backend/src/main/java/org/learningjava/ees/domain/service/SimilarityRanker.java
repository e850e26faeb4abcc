package org.learningjava.ees.domain.service;

import org.learningjava.ees.domain.model.embedding.EmbeddingRecord;
import org.learningjava.ees.domain.model.embedding.SimilarEmbedding;
import org.learningjava.ees.domain.model.embedding.SimilarityQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Exact nearest-neighbour ranking over a candidate set supplied by the store.
 * Candidates of another model, or of another dimension than the query, are skipped: vectors from
 * different spaces are never compared.
 */
public class SimilarityRanker {

    private static final Logger log = LoggerFactory.getLogger(SimilarityRanker.class);

    private static final Comparator<SimilarEmbedding> BEST_FIRST =
            Comparator.comparingDouble(SimilarEmbedding::similarity).reversed()
                    .thenComparingLong(SimilarEmbedding::id);

    public List<SimilarEmbedding> rank(SimilarityQuery query, List<EmbeddingRecord> candidates) {
        float[] q = query.queryEmbedding();
        List<SimilarEmbedding> scored = new ArrayList<>(candidates.size());
        int skipped = 0;

        for (EmbeddingRecord c : candidates) {
            if (!query.modelName().equals(c.modelName()) || c.dimensions() != q.length) {
                skipped++;
                continue;
            }
            double s = SimilarityCalculator.score(query.metric(), q, c.embedding());
            if (Double.isNaN(s)) {
                skipped++;
                continue;
            }
            if (query.threshold() != null && s < query.threshold()) continue;
            scored.add(new SimilarEmbedding(c.id(), c.uri(), c.text(), c.modelName(), s, c.createdAt(), c.updatedAt()));
        }

        if (skipped > 0) {
            log.debug("Skipped {} candidate(s) not comparable with query (model={}, dim={})",
                    skipped, query.modelName(), q.length);
        }

        scored.sort(BEST_FIRST);
        return scored.size() > query.limit() ? List.copyOf(scored.subList(0, query.limit())) : List.copyOf(scored);
    }
}
