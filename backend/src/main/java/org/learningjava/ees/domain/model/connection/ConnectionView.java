package org.learningjava.ees.domain.model.connection;

import org.learningjava.ees.domain.model.provider.ConnectionType;

import java.time.Instant;
import java.util.Map;

/** Read projection of a connection. Api keys are write-only and never appear here. */
public record ConnectionView(
        long id,
        String name,
        ConnectionType type,
        String baseUrl,
        String defaultModel,
        Map<String, Object> metadata,
        boolean active,
        Instant createdAt,
        Instant updatedAt
) {}
