package org.learningjava.ees.application.port;

import org.learningjava.ees.domain.model.provider.EmbeddingResult;
import org.learningjava.ees.domain.model.provider.ModelInfo;

import java.util.List;
import java.util.Optional;

/**
 * Contract every provider adapter implements. All failures leave as one of the
 * {@link org.learningjava.ees.domain.error.ProviderException} subclasses.
 */
public interface EmbeddingProviderPort {

    /** Type tag of the backend, e.g. {@code ollama}. */
    String provider();

    /**
     * @param modelName null to use the adapter's configured default
     */
    EmbeddingResult generateEmbedding(String text, String modelName);

    /**
     * Catalog used for capability checks. Never throws for an unreachable backend: returns the
     * static fallback or an empty list instead.
     */
    List<ModelInfo> listModels();

    /**
     * Same catalog, but connection and authentication failures are thrown. Used where the caller
     * needs to know the backend is reachable (switching providers, testing connections).
     */
    List<ModelInfo> fetchModels();

    /** Exact, case-sensitive presence in {@link #listModels()}. */
    default boolean isModelAvailable(String modelName) {
        if (modelName == null) return false;
        return listModels().stream().anyMatch(m -> modelName.equals(m.name()));
    }

    default Optional<ModelInfo> getModelInfo(String modelName) {
        if (modelName == null) return Optional.empty();
        return listModels().stream().filter(m -> modelName.equals(m.name())).findFirst();
    }
}
