package org.learningjava.ees.infrastructure.adapter.out.ollama;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.learningjava.ees.application.port.EmbeddingProviderPort;
import org.learningjava.ees.domain.error.ProviderConnectionException;
import org.learningjava.ees.domain.error.ProviderException;
import org.learningjava.ees.domain.model.provider.ConnectionType;
import org.learningjava.ees.domain.model.provider.EmbeddingResult;
import org.learningjava.ees.domain.model.provider.ModelInfo;
import org.learningjava.ees.domain.model.provider.ProviderConfig;
import org.learningjava.ees.domain.service.ModelNames;
import org.learningjava.ees.infrastructure.adapter.out.http.ProviderErrorMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Talks to a local (or proxied) Ollama server: {@code POST /api/embed} for vectors,
 * {@code GET /api/tags} for the installed models.
 */
public class OllamaEmbeddingAdapter implements EmbeddingProviderPort {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingAdapter.class);

    static final String PROVIDER = ConnectionType.OLLAMA.tag();
    static final String FALLBACK_MODEL = "nomic-embed-text";

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient http;
    private final ObjectMapper om;
    private final String baseUrl;
    private final ProviderConfig config;
    private final ProviderErrorMapper errors = new ProviderErrorMapper(PROVIDER);

    public OllamaEmbeddingAdapter(ProviderConfig config, OkHttpClient http, ObjectMapper om) {
        this.config = Objects.requireNonNull(config, "config");
        this.http = Objects.requireNonNull(http, "http");
        this.om = om;
        String url = config.baseUrl();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String preview(String text) {
        return text.replace("\n", " ").substring(0, Math.min(40, text.length()));
    }

    @Override
    public String provider() { return PROVIDER; }

    @Override
    public EmbeddingResult generateEmbedding(String text, String modelName) {
        Objects.requireNonNull(text, "text");
        String model = ModelNames.resolve(modelName, config.defaultModel(), FALLBACK_MODEL);

        ObjectNode body = om.createObjectNode();
        body.put("model", model);
        body.putArray("input").add(text);

        Request req;
        try {
            req = requestBuilder("/api/embed")
                    .post(RequestBody.create(om.writeValueAsBytes(body), JSON))
                    .build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw errors.unclassified(e);
        }

        try (Response resp = http.newCall(req).execute()) {
            String raw = resp.body() != null ? resp.body().string() : "";
            if (!resp.isSuccessful()) {
                log.warn("Ollama embed failed: HTTP {} for model '{}'", resp.code(), model);
                throw errors.fromStatus(resp.code(), raw, model, resp.header("Retry-After"), null);
            }
            if (log.isDebugEnabled()) log.debug("Ollama raw embedding response: {} bytes", raw.length());

            JsonNode json = om.readTree(raw);
            float[] v = extractVector(json);
            if (v.length == 0) {
                throw new ProviderConnectionException(PROVIDER,
                        "Unexpected embeddings payload from Ollama for model '" + model + "'", "INVALID_RESPONSE", null);
            }

            Integer tokens = json.has("prompt_eval_count") && json.get("prompt_eval_count").canConvertToInt()
                    ? json.get("prompt_eval_count").asInt() : null;

            log.debug("Embedding dim={} model={} for text preview='{}...'", v.length, model, preview(text));
            return new EmbeddingResult(v, model, PROVIDER, tokens);
        } catch (ProviderException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw invalidResponse(e);
        } catch (IOException e) {
            log.error("Embedding failed for model '{}' at {}: {}", model, baseUrl, e.getMessage());
            throw errors.fromTransport(e, baseUrl);
        } catch (RuntimeException e) {
            throw errors.unclassified(e);
        }
    }

    @Override
    public List<ModelInfo> listModels() {
        try {
            return fetchModels();
        } catch (ProviderException e) {
            log.warn("Ollama tags fetch failed ({}). Returning empty list.", e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<ModelInfo> fetchModels() {
        try (Response resp = http.newCall(requestBuilder("/api/tags").get().build()).execute()) {
            String raw = resp.body() != null ? resp.body().string() : "";
            if (!resp.isSuccessful()) {
                throw errors.fromStatus(resp.code(), raw, null, resp.header("Retry-After"), null);
            }
            JsonNode models = om.readTree(raw).path("models");
            if (!models.isArray()) {
                // server answered but without a catalog; assume the usual default is there
                return List.of(new ModelInfo(FALLBACK_MODEL, FALLBACK_MODEL, PROVIDER, 768, 8192, 0.0));
            }

            // several tags of one model collapse into one entry, first tag wins
            Map<String, ModelInfo> byName = new LinkedHashMap<>();
            for (JsonNode m : models) {
                String full = m.path("name").asText(m.path("model").asText(""));
                if (full.isBlank()) continue;
                String name = ModelNames.stripTag(full);
                byName.putIfAbsent(name, new ModelInfo(name, full, PROVIDER, null, null, 0.0));
            }
            return new ArrayList<>(byName.values());
        } catch (ProviderException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw invalidResponse(e);
        } catch (IOException e) {
            throw errors.fromTransport(e, baseUrl);
        } catch (RuntimeException e) {
            throw errors.unclassified(e);
        }
    }

    private Request.Builder requestBuilder(String path) {
        Request.Builder b = new Request.Builder()
                .url(baseUrl + path)
                .header("Accept", "application/json");
        // Ollama itself has no auth, but it often sits behind a proxy that does
        if (config.hasApiKey()) b.header("Authorization", "Bearer " + config.apiKey());
        config.headers().forEach(b::header);
        return b;
    }

    private static ProviderConnectionException invalidResponse(Exception e) {
        return new ProviderConnectionException(PROVIDER, "Invalid JSON from Ollama: " + e.getMessage(), "INVALID_RESPONSE", e);
    }

    private float[] extractVector(JsonNode json) {
        if (json.has("embeddings") && json.get("embeddings").isArray() && json.get("embeddings").size() > 0) {
            JsonNode first = json.get("embeddings").get(0);
            return first.isArray() ? toFloatArray(first) : new float[0];
        }
        if (json.has("embedding")) {
            // older /api/embeddings shape
            return toFloatArray(json.get("embedding"));
        }
        return new float[0];
    }

    private float[] toFloatArray(JsonNode arr) {
        if (arr == null || !arr.isArray()) {
            throw new ProviderConnectionException(PROVIDER, "Expected numeric array, got: " + arr, "INVALID_RESPONSE", null);
        }
        float[] v = new float[arr.size()];
        for (int i = 0; i < arr.size(); i++) v[i] = (float) arr.get(i).asDouble();
        return v;
    }
}
