package org.learningjava.ees.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelNamesTest {

    @Test
    void stripTag_dropsOnlyTheLastTag() {
        assertEquals("nomic-embed-text", ModelNames.stripTag("nomic-embed-text:latest"));
        assertEquals("registry.local/team/embed", ModelNames.stripTag("registry.local/team/embed:v2"));
        assertEquals("all-minilm", ModelNames.stripTag("all-minilm"));
        assertNull(ModelNames.stripTag(null));
    }

    @Test
    void stripTag_leavesRegistryPortAlone() {
        assertEquals("registry.local:5000/nomic-embed-text", ModelNames.stripTag("registry.local:5000/nomic-embed-text"));
        assertEquals("registry.local:5000/nomic-embed-text", ModelNames.stripTag("registry.local:5000/nomic-embed-text:v1.5"));
    }

    @Test
    void resolve_prefersRequest_thenConfigured_thenFallback() {
        assertEquals("a", ModelNames.resolve("a", "b", "c"));
        assertEquals("b", ModelNames.resolve(" ", "b", "c"));
        assertEquals("c", ModelNames.resolve(null, null, "c"));
    }
}
