package org.learningjava.ees.domain.service;

import org.junit.jupiter.api.Test;
import org.learningjava.ees.domain.error.InvalidConnectionException;
import org.learningjava.ees.domain.model.provider.ConnectionType;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionValidatorTest {

    @Test
    void requireType_acceptsKnownTags() {
        assertEquals(ConnectionType.OLLAMA, ConnectionValidator.requireType("ollama"));
        assertEquals(ConnectionType.OPENAI_COMPATIBLE, ConnectionValidator.requireType("openai-compatible"));
    }

    @Test
    void requireType_rejectsUnknownTag() {
        var ex = assertThrows(InvalidConnectionException.class, () -> ConnectionValidator.requireType("cohere"));
        assertTrue(ex.getMessage().contains("cohere"));
        assertThrows(InvalidConnectionException.class, () -> ConnectionValidator.requireType(null));
    }

    @Test
    void requireBaseUrl_stripsTrailingSlashes() {
        assertEquals("http://localhost:11434", ConnectionValidator.requireBaseUrl("http://localhost:11434//"));
        assertEquals("https://api.example.com/v1", ConnectionValidator.requireBaseUrl(" https://api.example.com/v1/ "));
    }

    @Test
    void requireBaseUrl_acceptsComposeStyleHostsWithUnderscores() {
        assertEquals("http://ollama_server:11434", ConnectionValidator.requireBaseUrl("http://ollama_server:11434/"));
        assertEquals("https://user@embed_gw/v1", ConnectionValidator.requireBaseUrl("https://user@embed_gw/v1"));
        assertThrows(InvalidConnectionException.class, () -> ConnectionValidator.requireBaseUrl("http://ollama_server:port"));
        assertThrows(InvalidConnectionException.class, () -> ConnectionValidator.requireBaseUrl("http:///api"));
    }

    @Test
    void requireBaseUrl_rejectsRelative_nonHttp_andBlank() {
        assertThrows(InvalidConnectionException.class, () -> ConnectionValidator.requireBaseUrl("localhost:11434"));
        assertThrows(InvalidConnectionException.class, () -> ConnectionValidator.requireBaseUrl("ftp://host/x"));
        assertThrows(InvalidConnectionException.class, () -> ConnectionValidator.requireBaseUrl("/api"));
        assertThrows(InvalidConnectionException.class, () -> ConnectionValidator.requireBaseUrl("  "));
        assertThrows(InvalidConnectionException.class, () -> ConnectionValidator.requireBaseUrl("http://bad host"));
    }

    @Test
    void requireName_trims_andRejectsBlank() {
        assertEquals("local", ConnectionValidator.requireName("  local "));
        assertThrows(InvalidConnectionException.class, () -> ConnectionValidator.requireName(""));
    }
}
