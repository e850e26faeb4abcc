package org.learningjava.ees.domain.model.connection;

import org.learningjava.ees.domain.model.provider.ProviderSwitchResult;

/**
 * Result of activating a connection. The activation itself is persisted even when the provider
 * switch was rejected; in that case the previously installed adapter keeps serving.
 */
public record ConnectionActivation(ConnectionView connection, ProviderSwitchResult providerSwitch) {}
