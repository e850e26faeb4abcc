package org.learningjava.ees.application.usecase;

import org.learningjava.ees.application.port.EmbeddingStorePort;
import org.learningjava.ees.domain.error.ProviderException;
import org.learningjava.ees.domain.error.StorageException;
import org.learningjava.ees.domain.model.batch.MigrationOptions;
import org.learningjava.ees.domain.model.batch.MigrationResult;
import org.learningjava.ees.domain.model.embedding.EmbeddingFilter;
import org.learningjava.ees.domain.model.embedding.EmbeddingPage;
import org.learningjava.ees.domain.model.embedding.EmbeddingRecord;
import org.learningjava.ees.domain.model.provider.EmbeddingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-embeds every record of one model with another and stores the new vectors under the target
 * model. The source rows are read up front so that deleting them along the way does not shift
 * the paging.
 */
@Service
public class MigrateEmbeddingsUseCase {

    private static final Logger log = LoggerFactory.getLogger(MigrateEmbeddingsUseCase.class);

    private final EmbeddingProviderFacade provider;
    private final EmbeddingStorePort store;

    public MigrateEmbeddingsUseCase(EmbeddingProviderFacade provider, EmbeddingStorePort store) {
        this.provider = provider;
        this.store = store;
    }

    public MigrationResult migrate(String fromModel, String toModel, MigrationOptions options) {
        CreateEmbeddingUseCase.requireNonBlank(fromModel, "fromModel");
        CreateEmbeddingUseCase.requireNonBlank(toModel, "toModel");
        if (fromModel.equals(toModel)) {
            throw new IllegalArgumentException("Source and target model are the same: " + fromModel);
        }
        MigrationOptions opts = options != null ? options : MigrationOptions.defaults();

        List<EmbeddingRecord> source = loadAll(fromModel, opts.pageSize());
        log.info("Migrating {} embeddings {} -> {} (preserveOriginal={}, continueOnError={})",
                source.size(), fromModel, toModel, opts.preserveOriginal(), opts.continueOnError());

        int migrated = 0;
        List<String> errors = new ArrayList<>();
        for (EmbeddingRecord rec : source) {
            try {
                EmbeddingResult r = provider.generateEmbedding(rec.text(), toModel);
                store.save(rec.uri(), rec.text(), r.model(), r.embedding());
                if (!opts.preserveOriginal()) {
                    store.deleteById(rec.id());
                }
                migrated++;
            } catch (ProviderException | StorageException e) {
                errors.add(rec.uri() + ": " + e.getMessage());
                log.warn("Migration of id={} uri={} failed: {}", rec.id(), rec.uri(), e.getMessage());
                if (!opts.continueOnError()) break;
            }
        }

        log.info("Migration {} -> {} finished: {}/{} migrated, {} failed",
                fromModel, toModel, migrated, source.size(), errors.size());
        return new MigrationResult(fromModel, toModel, source.size(), migrated, errors.size(), List.copyOf(errors));
    }

    private List<EmbeddingRecord> loadAll(String model, int pageSize) {
        List<EmbeddingRecord> all = new ArrayList<>();
        int page = 1;
        EmbeddingPage p;
        do {
            p = store.findAll(EmbeddingFilter.byModel(model, page++, pageSize));
            all.addAll(p.embeddings());
        } while (p.hasNext());
        return all;
    }
}
