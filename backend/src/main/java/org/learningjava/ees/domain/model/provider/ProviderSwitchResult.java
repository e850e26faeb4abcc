package org.learningjava.ees.domain.model.provider;

import java.util.List;

/**
 * Outcome of a provider switch. On failure {@code activeProvider} names the provider that is
 * still installed.
 */
public record ProviderSwitchResult(
        boolean success,
        String activeProvider,
        String message,
        List<String> models
) {
    public static ProviderSwitchResult ok(String provider, List<String> models) {
        return new ProviderSwitchResult(true, provider, "Switched to provider " + provider, List.copyOf(models));
    }

    public static ProviderSwitchResult failed(String stillActive, String message) {
        return new ProviderSwitchResult(false, stillActive, message, List.of());
    }
}
