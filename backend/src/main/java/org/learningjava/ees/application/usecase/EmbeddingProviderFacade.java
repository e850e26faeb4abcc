package org.learningjava.ees.application.usecase;

import org.learningjava.ees.application.port.EmbeddingProviderPort;
import org.learningjava.ees.domain.error.InvalidConnectionException;
import org.learningjava.ees.domain.error.ProviderException;
import org.learningjava.ees.domain.model.provider.ConnectionType;
import org.learningjava.ees.domain.model.provider.EmbeddingResult;
import org.learningjava.ees.domain.model.provider.ModelInfo;
import org.learningjava.ees.domain.model.provider.ProviderConfig;
import org.learningjava.ees.domain.model.provider.ProviderSwitchResult;
import org.learningjava.ees.domain.service.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single entry point to "the current provider". Calls go to whichever adapter is installed at the
 * moment they start; {@link #switchProvider} replaces it only after the new backend answered.
 */
public class EmbeddingProviderFacade {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingProviderFacade.class);

    private final ProviderRegistry registry;
    private final AtomicReference<EmbeddingProviderPort> current;
    private final ReentrantLock switchLock = new ReentrantLock();

    public EmbeddingProviderFacade(ProviderRegistry registry, ProviderConfig initial) {
        this.registry = registry;
        this.current = new AtomicReference<>(registry.create(initial));
        log.info("Embedding provider initialised: {}", initial);
    }

    public EmbeddingResult generateEmbedding(String text, String modelName) {
        return current.get().generateEmbedding(text, modelName);
    }

    public List<ModelInfo> listModels() {
        return current.get().listModels();
    }

    public boolean isModelAvailable(String modelName) {
        return current.get().isModelAvailable(modelName);
    }

    public Optional<ModelInfo> getModelInfo(String modelName) {
        return current.get().getModelInfo(modelName);
    }

    public ProviderSwitchResult switchProvider(ProviderConfig config) {
        switchLock.lock();
        try {
            String before = current.get().provider();
            EmbeddingProviderPort candidate;
            List<ModelInfo> models;
            try {
                candidate = registry.create(config);
                models = candidate.fetchModels();
            } catch (ProviderException | InvalidConnectionException e) {
                log.warn("Provider switch to {} rejected, keeping {}: {}", config, before, e.getMessage());
                return ProviderSwitchResult.failed(before,
                        "Failed to switch to " + config.type() + ": " + e.getMessage());
            }

            current.set(candidate);
            log.info("Switched embedding provider {} -> {} ({} models)", before, candidate.provider(), models.size());
            return ProviderSwitchResult.ok(candidate.provider(), models.stream().map(ModelInfo::name).toList());
        } finally {
            switchLock.unlock();
        }
    }

    public String getCurrentProvider() {
        return current.get().provider();
    }

    public List<String> listAllProviders() {
        return registry.listProviders().stream().map(ConnectionType::tag).toList();
    }
}
