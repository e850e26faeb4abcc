package org.learningjava.ees.infrastructure.adapter.out.openai;

import org.learningjava.ees.application.port.EmbeddingProviderPort;
import org.learningjava.ees.application.port.ProviderAdapterFactory;
import org.learningjava.ees.domain.model.provider.ConnectionType;
import org.learningjava.ees.domain.model.provider.ProviderConfig;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

public class OpenAiCompatibleAdapterFactory implements ProviderAdapterFactory {

    private final RestTemplate rest;

    public OpenAiCompatibleAdapterFactory(int connectTimeoutMs, int readTimeoutMs) {
        this(buildRestTemplate(connectTimeoutMs, readTimeoutMs));
    }

    public OpenAiCompatibleAdapterFactory(RestTemplate rest) {
        this.rest = rest;
    }

    @Override
    public ConnectionType type() { return ConnectionType.OPENAI_COMPATIBLE; }

    @Override
    public EmbeddingProviderPort create(ProviderConfig config) {
        return new OpenAiCompatibleEmbeddingAdapter(config, rest);
    }

    private static RestTemplate buildRestTemplate(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout(connectTimeoutMs);
        f.setReadTimeout(readTimeoutMs);
        return new RestTemplate(f);
    }
}
