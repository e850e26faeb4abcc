package org.learningjava.ees.domain.model.batch;

import java.util.List;

public record MigrationResult(
        String fromModel,
        String toModel,
        int total,
        int migrated,
        int failed,
        List<String> errors
) {}
