package org.learningjava.ees.application.usecase;

import org.learningjava.ees.application.port.ConnectionStorePort;
import org.learningjava.ees.domain.error.ConnectionNotFoundException;
import org.learningjava.ees.domain.error.InvalidConnectionException;
import org.learningjava.ees.domain.error.ProviderException;
import org.learningjava.ees.domain.error.StorageException;
import org.learningjava.ees.domain.model.connection.Connection;
import org.learningjava.ees.domain.model.connection.ConnectionActivation;
import org.learningjava.ees.domain.model.connection.ConnectionPatch;
import org.learningjava.ees.domain.model.connection.ConnectionTestRequest;
import org.learningjava.ees.domain.model.connection.ConnectionTestResult;
import org.learningjava.ees.domain.model.connection.ConnectionView;
import org.learningjava.ees.domain.model.connection.NewConnection;
import org.learningjava.ees.domain.model.provider.ConnectionType;
import org.learningjava.ees.domain.model.provider.ModelInfo;
import org.learningjava.ees.domain.model.provider.ProviderConfig;
import org.learningjava.ees.domain.model.provider.ProviderSwitchResult;
import org.learningjava.ees.domain.service.ConnectionValidator;
import org.learningjava.ees.domain.service.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Connection CRUD plus activation. Everything returned to callers is a {@link ConnectionView};
 * the api key only leaves through {@link #getActiveConfig()}.
 */
@Service
public class ManageConnectionsUseCase {

    private static final Logger log = LoggerFactory.getLogger(ManageConnectionsUseCase.class);

    private final ConnectionStorePort store;
    private final ProviderRegistry registry;
    private final EmbeddingProviderFacade provider;

    public ManageConnectionsUseCase(ConnectionStorePort store, ProviderRegistry registry,
                                    EmbeddingProviderFacade provider) {
        this.store = store;
        this.registry = registry;
        this.provider = provider;
    }

    public List<ConnectionView> list() {
        return store.findAll().stream().map(Connection::toView).toList();
    }

    public Optional<ConnectionView> get(long id) {
        return store.findById(id).map(Connection::toView);
    }

    public Optional<ConnectionView> getActive() {
        return store.findActive().map(Connection::toView);
    }

    /** Full row of the active connection, key included. Not for display. */
    public Optional<Connection> getActiveConfig() {
        return store.findActive();
    }

    public ConnectionView create(NewConnection req) {
        String name = ConnectionValidator.requireName(req.name());
        ConnectionType type = ConnectionValidator.requireType(req.type());
        String baseUrl = ConnectionValidator.requireBaseUrl(req.baseUrl());

        Connection created = store.create(name, type, baseUrl, blankToNull(req.apiKey()),
                blankToNull(req.defaultModel()), req.metadata(), req.active());
        if (created.active()) {
            applyToProvider(created);
        }
        return created.toView();
    }

    public ConnectionView update(long id, ConnectionPatch patch) {
        ConnectionPatch checked = patch;
        if (patch.name() != null) checked = checked.withName(ConnectionValidator.requireName(patch.name()));
        if (patch.baseUrl() != null) checked = checked.withBaseUrl(ConnectionValidator.requireBaseUrl(patch.baseUrl()));

        Connection updated = store.update(id, checked)
                .orElseThrow(() -> new ConnectionNotFoundException(id));
        if (updated.active()) {
            // settings of the active connection changed, or it was just activated
            applyToProvider(updated);
        }
        return updated.toView();
    }

    public boolean delete(long id) {
        return store.delete(id);
    }

    /**
     * Persists the activation, then tries to switch the provider to it. A rejected switch does not
     * undo the activation; the previous adapter stays installed and the outcome says why.
     */
    public ConnectionActivation setActive(long id) {
        if (!store.setActive(id)) {
            throw new ConnectionNotFoundException(id);
        }
        Connection active = store.findById(id).orElseThrow(() -> new ConnectionNotFoundException(id));
        return new ConnectionActivation(active.toView(), applyToProvider(active));
    }

    /** Builds a throwaway adapter and asks it for its catalog. Never throws, never persists. */
    public ConnectionTestResult testConnection(ConnectionTestRequest req) {
        try {
            ProviderConfig config = resolveTestConfig(req);
            List<String> models = registry.create(config).fetchModels().stream().map(ModelInfo::name).toList();
            log.info("Connection test against {} succeeded ({} models)", config.baseUrl(), models.size());
            return ConnectionTestResult.ok(models);
        } catch (ProviderException | InvalidConnectionException | ConnectionNotFoundException | StorageException e) {
            log.warn("Connection test failed: {}", e.getMessage());
            return ConnectionTestResult.failed(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Connection test failed unexpectedly", e);
            return ConnectionTestResult.failed("Connection test failed: " + e);
        }
    }

    private ProviderConfig resolveTestConfig(ConnectionTestRequest req) {
        if (req.id() != null) {
            return store.findById(req.id())
                    .orElseThrow(() -> new ConnectionNotFoundException(req.id()))
                    .toProviderConfig();
        }
        if (req.type() == null || req.baseUrl() == null) {
            throw new InvalidConnectionException("baseUrl and type are required for testing");
        }
        return new ProviderConfig(ConnectionValidator.requireType(req.type()),
                ConnectionValidator.requireBaseUrl(req.baseUrl()), blankToNull(req.apiKey()), null);
    }

    private ProviderSwitchResult applyToProvider(Connection c) {
        ProviderSwitchResult r = provider.switchProvider(c.toProviderConfig());
        if (!r.success()) {
            log.warn("Connection '{}' is active but the provider switch failed: {}", c.name(), r.message());
        }
        return r;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
