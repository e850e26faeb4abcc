package org.learningjava.ees.domain.model.connection;

import org.junit.jupiter.api.Test;
import org.learningjava.ees.domain.model.provider.ConnectionType;
import org.learningjava.ees.domain.model.provider.ProviderConfig;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionTest {

    private static Connection withKey(Map<String, Object> metadata) {
        return new Connection(7, "gateway", ConnectionType.OPENAI_COMPATIBLE, "https://llm.example.com",
                "sk-secret", "text-embedding-3-small", metadata, true, Instant.now(), Instant.now());
    }

    @Test
    void view_andToString_neverCarryTheApiKey() {
        Connection c = withKey(Map.of());
        ConnectionView v = c.toView();

        assertEquals(7, v.id());
        assertEquals("gateway", v.name());
        assertFalse(v.toString().contains("sk-secret"));
        assertFalse(c.toString().contains("sk-secret"));
    }

    @Test
    void providerConfig_carriesKey_andHeadersFromMetadata() {
        Connection c = withKey(Map.of("headers", Map.of("X-Org", "acme"), "note", "x"));
        ProviderConfig cfg = c.toProviderConfig();

        assertEquals("sk-secret", cfg.apiKey());
        assertEquals(Map.of("X-Org", "acme"), cfg.headers());
        assertFalse(cfg.toString().contains("sk-secret"));
    }

    @Test
    void headers_ignoresNonMapValue() {
        assertTrue(withKey(Map.of("headers", "nope")).headers().isEmpty());
        assertTrue(withKey(null).headers().isEmpty());
    }
}
