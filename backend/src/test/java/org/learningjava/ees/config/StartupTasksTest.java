package org.learningjava.ees.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.ees.application.port.ConnectionStorePort;
import org.learningjava.ees.application.port.EmbeddingStorePort;
import org.learningjava.ees.application.usecase.EmbeddingProviderFacade;
import org.learningjava.ees.domain.model.connection.Connection;
import org.learningjava.ees.domain.model.provider.ConnectionType;
import org.learningjava.ees.domain.model.provider.ProviderSwitchResult;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StartupTasksTest {

    private EmbeddingStorePort embeddings;
    private ConnectionStorePort connections;
    private EmbeddingProviderFacade provider;
    private EesProperties props;
    private StartupTasks tasks;

    @BeforeEach
    void setUp() {
        embeddings = mock(EmbeddingStorePort.class);
        connections = mock(ConnectionStorePort.class);
        provider = mock(EmbeddingProviderFacade.class);
        props = new EesProperties();
        tasks = new StartupTasks(embeddings, connections, provider, props);
    }

    @Test
    void createsSchemas_andSwitchesToStoredActiveConnection() {
        var active = new Connection(1, "gpu-box", ConnectionType.OLLAMA, "http://gpu-box:11434", null,
                "nomic-embed-text", Map.of(), true, Instant.now(), Instant.now());
        when(connections.findActive()).thenReturn(Optional.of(active));
        when(provider.switchProvider(any())).thenReturn(ProviderSwitchResult.ok("ollama", List.of()));

        tasks.run(new DefaultApplicationArguments());

        verify(embeddings).ensureSchema();
        verify(connections).ensureSchema();
        verify(provider).switchProvider(active.toProviderConfig());
    }

    @Test
    void noActiveConnection_keepsDefaultProvider() {
        when(connections.findActive()).thenReturn(Optional.empty());
        props.setEnsureSchemaOnStartup(false);

        tasks.run(new DefaultApplicationArguments());

        verify(embeddings, never()).ensureSchema();
        verify(provider, never()).switchProvider(any());
    }
}
