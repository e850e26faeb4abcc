package org.learningjava.ees.infrastructure.adapter.out.openai;

import com.fasterxml.jackson.databind.JsonNode;
import org.learningjava.ees.application.port.EmbeddingProviderPort;
import org.learningjava.ees.domain.error.ProviderConnectionException;
import org.learningjava.ees.domain.error.ProviderException;
import org.learningjava.ees.domain.error.ProviderModelException;
import org.learningjava.ees.domain.model.provider.ConnectionType;
import org.learningjava.ees.domain.model.provider.EmbeddingResult;
import org.learningjava.ees.domain.model.provider.ModelInfo;
import org.learningjava.ees.domain.model.provider.ProviderConfig;
import org.learningjava.ees.infrastructure.adapter.out.http.ProviderErrorMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Any server speaking the OpenAI embeddings dialect: LM Studio, LocalAI, vLLM, hosted gateways.
 * The base URL may be given with or without the trailing {@code /v1}.
 */
public class OpenAiCompatibleEmbeddingAdapter implements EmbeddingProviderPort {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleEmbeddingAdapter.class);

    static final String PROVIDER = ConnectionType.OPENAI_COMPATIBLE.tag();

    private final RestTemplate rest;
    private final ProviderConfig config;
    private final String apiRoot;
    private final ProviderErrorMapper errors = new ProviderErrorMapper(PROVIDER);

    public OpenAiCompatibleEmbeddingAdapter(ProviderConfig config, RestTemplate rest) {
        this.config = Objects.requireNonNull(config, "config");
        this.rest = Objects.requireNonNull(rest, "rest");
        String base = trimTrailingSlash(config.baseUrl());
        this.apiRoot = base.endsWith("/v1") ? base : base + "/v1";
        log.debug("OpenAiCompatibleEmbeddingAdapter init: apiRoot={}, apiKey={}", apiRoot, config.hasApiKey() ? "****" : "none");
    }

    @Override
    public String provider() { return PROVIDER; }

    @Override
    public EmbeddingResult generateEmbedding(String text, String modelName) {
        Objects.requireNonNull(text, "text");
        String model = modelName != null && !modelName.isBlank() ? modelName : config.defaultModel();
        if (model == null || model.isBlank()) {
            throw new ProviderModelException(PROVIDER, "unknown",
                    "No model specified and no default model configured");
        }

        final String url = apiRoot + "/embeddings";
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(Map.of("model", model, "input", text), headers());

        try {
            ResponseEntity<JsonNode> response = rest.postForEntity(url, request, JsonNode.class);
            JsonNode body = response.getBody();
            if (body == null) {
                throw new ProviderConnectionException(PROVIDER, "Empty response from " + url, "INVALID_RESPONSE", null);
            }

            // data[0].embedding
            JsonNode vec = body.path("data").path(0).path("embedding");
            if (!vec.isArray() || vec.isEmpty()) {
                log.warn("Response missing data[0].embedding for model='{}'", model);
                throw new ProviderConnectionException(PROVIDER,
                        "Unexpected embeddings payload for model '" + model + "'", "INVALID_RESPONSE", null);
            }
            float[] v = new float[vec.size()];
            for (int i = 0; i < vec.size(); i++) v[i] = (float) vec.get(i).asDouble();

            JsonNode usage = body.path("usage");
            // many local servers send no usage block at all
            Integer tokens = null;
            if (usage.path("total_tokens").canConvertToInt()) {
                tokens = usage.path("total_tokens").asInt();
            } else if (usage.path("prompt_tokens").canConvertToInt()) {
                tokens = usage.path("prompt_tokens").asInt();
            }

            String reported = body.path("model").asText(model);
            log.debug("Embedding dim={} model={} tokens={}", v.length, reported, tokens);
            // keep the requested name: it is the storage key callers will search with
            return new EmbeddingResult(v, model, PROVIDER, tokens);
        } catch (HttpStatusCodeException ex) {
            log.error("{} HTTP {} for model='{}'", PROVIDER, ex.getStatusCode().value(), model);
            throw errors.fromStatus(ex.getStatusCode().value(), safeBody(ex), model, retryAfter(ex), ex);
        } catch (ResourceAccessException io) {
            log.error("{} connection error to {}: {}", PROVIDER, url, io.toString());
            throw errors.fromTransport(io, apiRoot);
        } catch (ProviderException e) {
            throw e;
        } catch (RestClientException | IllegalArgumentException e) {
            throw errors.unclassified(e);
        }
    }

    @Override
    public List<ModelInfo> listModels() {
        try {
            return fetchModels();
        } catch (ProviderException e) {
            log.warn("Failed to fetch {} models: {}", PROVIDER, e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<ModelInfo> fetchModels() {
        final String url = apiRoot + "/models";
        try {
            ResponseEntity<JsonNode> resp = rest.exchange(url, HttpMethod.GET, new HttpEntity<>(headers()), JsonNode.class);
            JsonNode data = resp.getBody() == null ? null : resp.getBody().path("data");
            if (data == null || !data.isArray()) return List.of();

            List<ModelInfo> out = new ArrayList<>();
            for (JsonNode m : data) {
                String id = m.path("id").asText("");
                if (!id.isBlank()) out.add(ModelInfo.of(id, PROVIDER));
            }
            return out;
        } catch (HttpStatusCodeException ex) {
            throw errors.fromStatus(ex.getStatusCode().value(), safeBody(ex), null, retryAfter(ex), ex);
        } catch (ResourceAccessException io) {
            throw errors.fromTransport(io, apiRoot);
        } catch (RestClientException | IllegalArgumentException e) {
            throw errors.unclassified(e);
        }
    }

    // ---- helpers ----

    private HttpHeaders headers() {
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        h.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (config.hasApiKey()) h.setBearerAuth(config.apiKey());
        config.headers().forEach(h::set);
        return h;
    }

    private static String trimTrailingSlash(String s) {
        if (s == null) return "";
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    private static String retryAfter(HttpStatusCodeException ex) {
        HttpHeaders h = ex.getResponseHeaders();
        return h == null ? null : h.getFirst(HttpHeaders.RETRY_AFTER);
    }

    private static String safeBody(HttpStatusCodeException ex) {
        String s = ex.getResponseBodyAsString();
        return s == null ? "" : s;
    }
}
