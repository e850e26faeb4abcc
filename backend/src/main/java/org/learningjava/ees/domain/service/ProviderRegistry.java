package org.learningjava.ees.domain.service;

import org.learningjava.ees.application.port.EmbeddingProviderPort;
import org.learningjava.ees.application.port.ProviderAdapterFactory;
import org.learningjava.ees.domain.error.InvalidConnectionException;
import org.learningjava.ees.domain.model.provider.ConnectionType;
import org.learningjava.ees.domain.model.provider.ProviderConfig;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Lookup table from connection type to the factory building its adapter. */
@Component
public class ProviderRegistry {
    private final Map<ConnectionType, ProviderAdapterFactory> factories = new EnumMap<>(ConnectionType.class);

    public ProviderRegistry(List<ProviderAdapterFactory> adapterFactories) {
        for (ProviderAdapterFactory f : adapterFactories) {
            factories.put(f.type(), f);
        }
    }

    public EmbeddingProviderPort create(ProviderConfig config) {
        ProviderAdapterFactory f = factories.get(config.type());
        if (f == null) {
            throw new InvalidConnectionException("Unsupported provider type: " + config.type());
        }
        return f.create(config);
    }

    public boolean supports(ConnectionType type) {
        return factories.containsKey(type);
    }

    public List<ConnectionType> listProviders() {
        return List.copyOf(factories.keySet());
    }
}
