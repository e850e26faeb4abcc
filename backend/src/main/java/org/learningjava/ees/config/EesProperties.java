package org.learningjava.ees.config;

import org.learningjava.ees.domain.model.provider.ProviderConfig;
import org.learningjava.ees.domain.service.ConnectionValidator;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ees")
public class EesProperties {
    private final Provider provider = new Provider();
    private final Http http = new Http();
    private final Batch batch = new Batch();
    private boolean ensureSchemaOnStartup = true;

    public Provider getProvider() { return provider; }
    public Http getHttp() { return http; }
    public Batch getBatch() { return batch; }
    public boolean isEnsureSchemaOnStartup() { return ensureSchemaOnStartup; }
    public void setEnsureSchemaOnStartup(boolean v) { this.ensureSchemaOnStartup = v; }

    /** Provider used until a stored connection is activated. */
    public static class Provider {
        private String type = "ollama";
        private String baseUrl = "http://localhost:11434";
        private String apiKey = "";
        private String defaultModel = "nomic-embed-text";

        public String getType() { return type; }
        public void setType(String v) { this.type = v; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String v) { this.baseUrl = v; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String v) { this.apiKey = v; }
        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String v) { this.defaultModel = v; }

        public ProviderConfig toConfig() {
            return new ProviderConfig(
                    ConnectionValidator.requireType(type),
                    ConnectionValidator.requireBaseUrl(baseUrl),
                    apiKey == null || apiKey.isBlank() ? null : apiKey,
                    defaultModel == null || defaultModel.isBlank() ? null : defaultModel);
        }
    }

    public static class Http {
        private int connectTimeoutMs = 5_000;
        private int readTimeoutMs = 60_000;

        public int getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(int v) { this.connectTimeoutMs = v; }
        public int getReadTimeoutMs() { return readTimeoutMs; }
        public void setReadTimeoutMs(int v) { this.readTimeoutMs = v; }
    }

    public static class Batch {
        private int concurrency = 4;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int v) { this.concurrency = v; }
    }
}
