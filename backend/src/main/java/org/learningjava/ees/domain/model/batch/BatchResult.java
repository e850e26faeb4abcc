package org.learningjava.ees.domain.model.batch;

import java.util.List;

/**
 * Batch outcome. Counts are computed from {@code results}, so
 * {@code total == successful + failed} cannot drift.
 */
public record BatchResult(List<BatchItemResult> results) {

    public BatchResult {
        results = List.copyOf(results);
    }

    public int total() {
        return results.size();
    }

    public int successful() {
        return (int) results.stream().filter(BatchItemResult::success).count();
    }

    public int failed() {
        return total() - successful();
    }
}
