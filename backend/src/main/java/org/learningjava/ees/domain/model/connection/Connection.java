package org.learningjava.ees.domain.model.connection;

import org.learningjava.ees.domain.model.provider.ConnectionType;
import org.learningjava.ees.domain.model.provider.ProviderConfig;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted connection row, api key included. Stays inside the core: anything handed to callers
 * goes through {@link #toView()}.
 */
public record Connection(
        long id,
        String name,
        ConnectionType type,
        String baseUrl,
        String apiKey,
        String defaultModel,
        Map<String, Object> metadata,
        boolean active,
        Instant createdAt,
        Instant updatedAt
) {
    public Connection {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public ConnectionView toView() {
        return new ConnectionView(id, name, type, baseUrl, defaultModel, metadata, active, createdAt, updatedAt);
    }

    public ProviderConfig toProviderConfig() {
        return new ProviderConfig(type, baseUrl, apiKey, defaultModel, headers());
    }

    /** Extra request headers kept under the {@code headers} metadata key. */
    public Map<String, String> headers() {
        Object raw = metadata.get("headers");
        if (!(raw instanceof Map<?, ?> m)) return Map.of();
        Map<String, String> out = new LinkedHashMap<>();
        m.forEach((k, v) -> {
            if (k != null && v != null) out.put(String.valueOf(k), String.valueOf(v));
        });
        return out;
    }

    @Override
    public String toString() {
        return "Connection[id=" + id + ", name=" + name + ", type=" + type + ", baseUrl=" + baseUrl
                + ", active=" + active + "]";
    }
}
