package org.learningjava.ees.domain.model.connection;

import java.util.Map;

/**
 * Create request. {@code type} is the raw tag so unknown variants can be rejected with a proper
 * message instead of failing in deserialization.
 */
public record NewConnection(
        String name,
        String type,
        String baseUrl,
        String apiKey,
        String defaultModel,
        Map<String, Object> metadata,
        boolean active
) {
    public NewConnection {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
