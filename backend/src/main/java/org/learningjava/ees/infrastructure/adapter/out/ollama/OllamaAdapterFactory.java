package org.learningjava.ees.infrastructure.adapter.out.ollama;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.learningjava.ees.application.port.EmbeddingProviderPort;
import org.learningjava.ees.application.port.ProviderAdapterFactory;
import org.learningjava.ees.domain.model.provider.ConnectionType;
import org.learningjava.ees.domain.model.provider.ProviderConfig;

/** All Ollama adapters share one OkHttp client (and so one connection pool). */
public class OllamaAdapterFactory implements ProviderAdapterFactory {

    private final OkHttpClient http;
    private final ObjectMapper om;

    public OllamaAdapterFactory(OkHttpClient http, ObjectMapper om) {
        this.http = http;
        this.om = om;
    }

    @Override
    public ConnectionType type() { return ConnectionType.OLLAMA; }

    @Override
    public EmbeddingProviderPort create(ProviderConfig config) {
        return new OllamaEmbeddingAdapter(config, http, om);
    }
}
