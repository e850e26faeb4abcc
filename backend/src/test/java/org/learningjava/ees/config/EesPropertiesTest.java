package org.learningjava.ees.config;

import org.junit.jupiter.api.Test;
import org.learningjava.ees.domain.error.InvalidConnectionException;
import org.learningjava.ees.domain.model.provider.ConnectionType;
import org.learningjava.ees.domain.model.provider.ProviderConfig;

import static org.junit.jupiter.api.Assertions.*;

class EesPropertiesTest {

    @Test
    void defaults_pointAtLocalOllama() {
        ProviderConfig cfg = new EesProperties().getProvider().toConfig();

        assertEquals(ConnectionType.OLLAMA, cfg.type());
        assertEquals("http://localhost:11434", cfg.baseUrl());
        assertEquals("nomic-embed-text", cfg.defaultModel());
        assertFalse(cfg.hasApiKey());
    }

    @Test
    void blankKeyAndModel_becomeNull_andBadTypeFailsFast() {
        EesProperties.Provider p = new EesProperties().getProvider();
        p.setType("openai-compatible");
        p.setBaseUrl("https://llm.example.com/");
        p.setApiKey(" ");
        p.setDefaultModel("");

        ProviderConfig cfg = p.toConfig();
        assertEquals("https://llm.example.com", cfg.baseUrl());
        assertNull(cfg.apiKey());
        assertNull(cfg.defaultModel());

        p.setType("bedrock");
        assertThrows(InvalidConnectionException.class, p::toConfig);
    }
}
