package org.learningjava.ees.domain.service;

import org.junit.jupiter.api.Test;
import org.learningjava.ees.application.port.EmbeddingProviderPort;
import org.learningjava.ees.application.port.ProviderAdapterFactory;
import org.learningjava.ees.domain.error.InvalidConnectionException;
import org.learningjava.ees.domain.model.provider.ConnectionType;
import org.learningjava.ees.domain.model.provider.ProviderConfig;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ProviderRegistryTest {

    @Test
    void create_usesFactoryForConfigType() {
        ProviderAdapterFactory ollama = mock(ProviderAdapterFactory.class);
        EmbeddingProviderPort adapter = mock(EmbeddingProviderPort.class);
        when(ollama.type()).thenReturn(ConnectionType.OLLAMA);
        when(ollama.create(any())).thenReturn(adapter);

        ProviderRegistry registry = new ProviderRegistry(List.of(ollama));
        var config = new ProviderConfig(ConnectionType.OLLAMA, "http://localhost:11434", null, null);

        assertSame(adapter, registry.create(config));
        verify(ollama).create(config);
        assertTrue(registry.supports(ConnectionType.OLLAMA));
        assertEquals(List.of(ConnectionType.OLLAMA), registry.listProviders());
    }

    @Test
    void create_unregisteredType_isInvalidConnection() {
        ProviderRegistry registry = new ProviderRegistry(List.of());
        var config = new ProviderConfig(ConnectionType.OPENAI_COMPATIBLE, "http://localhost:1234", null, "m");

        assertThrows(InvalidConnectionException.class, () -> registry.create(config));
        assertFalse(registry.supports(ConnectionType.OPENAI_COMPATIBLE));
    }
}
