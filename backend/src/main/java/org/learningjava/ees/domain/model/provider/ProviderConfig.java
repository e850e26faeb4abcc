package org.learningjava.ees.domain.model.provider;

import java.util.Map;
import java.util.Objects;

/**
 * Everything an adapter needs to talk to one backend. Built from a connection row or from the
 * application defaults.
 */
public record ProviderConfig(
        ConnectionType type,
        String baseUrl,
        String apiKey,        // nullable, local servers usually run without one
        String defaultModel,  // nullable
        Map<String, String> headers
) {
    public ProviderConfig {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(baseUrl, "baseUrl");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public ProviderConfig(ConnectionType type, String baseUrl, String apiKey, String defaultModel) {
        this(type, baseUrl, apiKey, defaultModel, Map.of());
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        // never print the key
        return "ProviderConfig[type=" + type + ", baseUrl=" + baseUrl + ", apiKey=" + (hasApiKey() ? "****" : "none")
                + ", defaultModel=" + defaultModel + ", headers=" + headers.keySet() + "]";
    }
}
