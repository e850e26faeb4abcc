package org.learningjava.ees.domain.model.connection;

import java.util.Map;

/** Partial update. Null fields keep the stored value; the api key is only replaced when given. */
public record ConnectionPatch(
        String name,
        String baseUrl,
        String apiKey,
        String defaultModel,
        Map<String, Object> metadata,
        Boolean active
) {
    public static ConnectionPatch empty() {
        return new ConnectionPatch(null, null, null, null, null, null);
    }

    public ConnectionPatch withName(String n) {
        return new ConnectionPatch(n, baseUrl, apiKey, defaultModel, metadata, active);
    }

    public ConnectionPatch withBaseUrl(String u) {
        return new ConnectionPatch(name, u, apiKey, defaultModel, metadata, active);
    }

    public ConnectionPatch withApiKey(String k) {
        return new ConnectionPatch(name, baseUrl, k, defaultModel, metadata, active);
    }

    public ConnectionPatch withDefaultModel(String m) {
        return new ConnectionPatch(name, baseUrl, apiKey, m, metadata, active);
    }

    public ConnectionPatch withActive(boolean a) {
        return new ConnectionPatch(name, baseUrl, apiKey, defaultModel, metadata, a);
    }
}
