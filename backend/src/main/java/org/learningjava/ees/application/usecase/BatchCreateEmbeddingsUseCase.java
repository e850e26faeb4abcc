package org.learningjava.ees.application.usecase;

import org.learningjava.ees.domain.error.ProviderException;
import org.learningjava.ees.domain.error.StorageException;
import org.learningjava.ees.domain.model.batch.BatchItem;
import org.learningjava.ees.domain.model.batch.BatchItemResult;
import org.learningjava.ees.domain.model.batch.BatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Embeds and stores a list of items on the batch executor. Per-item failures become failure
 * results; the batch itself only fails on a null input list.
 *
 * <p>Items sharing a uri are chained and run in input order, so for duplicates the last entry is
 * the one left in the store. Results come back in input order whatever order the work finished in.
 */
@Service
public class BatchCreateEmbeddingsUseCase {

    private static final Logger log = LoggerFactory.getLogger(BatchCreateEmbeddingsUseCase.class);

    private final CreateEmbeddingUseCase create;
    private final TaskExecutor executor;

    public BatchCreateEmbeddingsUseCase(CreateEmbeddingUseCase create,
                                        @Qualifier("batchTaskExecutor") TaskExecutor executor) {
        this.create = create;
        this.executor = executor;
    }

    /**
     * @param batchModel used for items without their own model; null for the provider default
     */
    public BatchResult run(List<BatchItem> items, String batchModel) {
        Objects.requireNonNull(items, "items");
        long start = System.currentTimeMillis();

        List<CompletableFuture<BatchItemResult>> futures = new ArrayList<>(items.size());
        Map<String, CompletableFuture<BatchItemResult>> lastByUri = new HashMap<>();

        for (BatchItem item : items) {
            String invalid = validate(item);
            if (invalid != null) {
                futures.add(CompletableFuture.completedFuture(
                        BatchItemResult.failure(item == null ? null : item.uri(), invalid)));
                continue;
            }

            String model = item.modelName() != null && !item.modelName().isBlank() ? item.modelName() : batchModel;
            CompletableFuture<BatchItemResult> previous = lastByUri.get(item.uri());
            CompletableFuture<BatchItemResult> f = previous == null
                    ? CompletableFuture.supplyAsync(() -> process(item, model), executor)
                    : previous.handleAsync((r, e) -> process(item, model), executor);
            lastByUri.put(item.uri(), f);
            futures.add(f);
        }

        List<BatchItemResult> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(await(futures.get(i), items.get(i)));
        }

        BatchResult out = new BatchResult(results);
        log.info("Batch done: total={} successful={} failed={} in {} ms",
                out.total(), out.successful(), out.failed(), System.currentTimeMillis() - start);
        return out;
    }

    private BatchItemResult process(BatchItem item, String model) {
        try {
            return BatchItemResult.success(create.create(item.uri(), item.text(), model));
        } catch (ProviderException | StorageException | IllegalArgumentException e) {
            log.warn("Batch item '{}' failed: {}", item.uri(), e.getMessage());
            return BatchItemResult.failure(item.uri(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Batch item '{}' failed unexpectedly", item.uri(), e);
            return BatchItemResult.failure(item.uri(), e.toString());
        }
    }

    private static BatchItemResult await(CompletableFuture<BatchItemResult> f, BatchItem item) {
        try {
            return f.join();
        } catch (CompletionException e) {
            // only reachable when the executor refused the task
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Batch item '{}' could not be scheduled", item.uri(), cause);
            return BatchItemResult.failure(item.uri(), cause.getMessage());
        }
    }

    private static String validate(BatchItem item) {
        if (item == null) return "Item must not be null";
        if (item.uri() == null || item.uri().isBlank()) return "uri must not be empty";
        if (item.text() == null || item.text().isBlank()) return "text must not be empty";
        return null;
    }
}
