package org.learningjava.ees.application.port;

import org.learningjava.ees.domain.model.provider.ConnectionType;
import org.learningjava.ees.domain.model.provider.ProviderConfig;

/** Builds adapters for one connection type. One implementation per backend. */
public interface ProviderAdapterFactory {

    ConnectionType type();

    EmbeddingProviderPort create(ProviderConfig config);
}
