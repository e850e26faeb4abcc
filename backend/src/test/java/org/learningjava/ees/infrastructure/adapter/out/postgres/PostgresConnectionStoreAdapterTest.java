package org.learningjava.ees.infrastructure.adapter.out.postgres;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.ees.application.port.ConnectionStorePort;
import org.learningjava.ees.domain.model.connection.Connection;
import org.learningjava.ees.domain.model.connection.ConnectionPatch;
import org.learningjava.ees.domain.model.provider.ConnectionType;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class PostgresConnectionStoreAdapterTest extends PostgresTestBase {

    private ConnectionStorePort store;

    @BeforeEach
    void init() {
        store = new PostgresConnectionStoreAdapter(dataSource());
        store.ensureSchema();
        truncate("connection_configs");
    }

    private Connection ollama(String name, boolean active) {
        return store.create(name, ConnectionType.OLLAMA, "http://localhost:11434", null, "nomic-embed-text",
                Map.of(), active);
    }

    private List<Long> activeIds() {
        return store.findAll().stream().filter(Connection::active).map(Connection::id).toList();
    }

    @Test
    void create_roundTrips_metadataAndKey() {
        Connection c = store.create("gateway", ConnectionType.OPENAI_COMPATIBLE, "https://llm.example.com", "sk-1",
                "text-embedding-3-small", Map.of("headers", Map.of("X-Org", "acme")), false);

        assertTrue(c.id() > 0);
        Connection loaded = store.findById(c.id()).orElseThrow();
        assertEquals(ConnectionType.OPENAI_COMPATIBLE, loaded.type());
        assertEquals("sk-1", loaded.apiKey());
        assertEquals(Map.of("X-Org", "acme"), loaded.headers());
        assertFalse(loaded.active());
        assertNotNull(loaded.createdAt());
    }

    @Test
    void activation_isExclusive_acrossTheC1C2C3Sequence() {
        Connection c1 = ollama("c1", false);
        Connection c2 = ollama("c2", false);
        Connection c3 = ollama("c3", false);

        assertTrue(store.setActive(c1.id()));
        assertEquals(List.of(c1.id()), activeIds());

        assertTrue(store.setActive(c2.id()));
        assertEquals(List.of(c2.id()), activeIds());
        assertEquals(c2.id(), store.findActive().orElseThrow().id());

        assertTrue(store.setActive(c3.id()));
        assertEquals(List.of(c3.id()), activeIds());
        assertFalse(store.findById(c1.id()).orElseThrow().active());
    }

    @Test
    void setActive_missingId_changesNothing() {
        Connection c1 = ollama("c1", true);

        assertFalse(store.setActive(987_654));
        assertEquals(List.of(c1.id()), activeIds());
    }

    @Test
    void createActive_deactivatesOthers() {
        Connection c1 = ollama("c1", true);
        Connection c2 = ollama("c2", true);

        assertEquals(List.of(c2.id()), activeIds());
        assertFalse(store.findById(c1.id()).orElseThrow().active());
    }

    @Test
    void update_appliesOnlyGivenFields_andCanActivate() {
        Connection c1 = ollama("c1", true);
        Connection c2 = store.create("c2", ConnectionType.OLLAMA, "http://gpu-box:11434", "k", "m", Map.of(), false);

        Connection updated = store.update(c2.id(), ConnectionPatch.empty().withName("renamed").withActive(true))
                .orElseThrow();

        assertEquals("renamed", updated.name());
        assertEquals("http://gpu-box:11434", updated.baseUrl());
        assertEquals("k", updated.apiKey());
        assertTrue(updated.active());
        assertEquals(List.of(c2.id()), activeIds());
        assertFalse(store.findById(c1.id()).orElseThrow().active());

        assertTrue(store.update(123_456, ConnectionPatch.empty().withName("x")).isEmpty());
    }

    @Test
    void findAll_isNewestFirst_andDeleteReportsExistence() {
        Connection c1 = ollama("c1", false);
        Connection c2 = ollama("c2", false);

        assertEquals(List.of(c2.id(), c1.id()), store.findAll().stream().map(Connection::id).toList());

        assertTrue(store.delete(c1.id()));
        assertFalse(store.delete(c1.id()));
        assertTrue(store.findActive().isEmpty());
    }

    @Test
    void database_refusesASecondActiveRow() {
        Connection c1 = ollama("c1", true);
        Connection c2 = ollama("c2", false);

        assertThrows(DataAccessException.class, () -> JdbcClient.create(dataSource())
                .sql("UPDATE connection_configs SET is_active = true WHERE id = :id")
                .param("id", c2.id())
                .update());
        assertEquals(List.of(c1.id()), activeIds());
    }

    @Test
    void activation_fromTwoStoreInstances_leavesExactlyOneActive() {
        // separate adapters stand in for separate app instances: no shared in-process lock
        ConnectionStorePort other = new PostgresConnectionStoreAdapter(dataSource());
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < 4; i++) ids.add(ollama("c" + i, false).id());

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<CompletableFuture<?>> futures = new ArrayList<>();
            for (int round = 0; round < 20; round++) {
                long a = ids.get(round % ids.size());
                long b = ids.get((round + 1) % ids.size());
                futures.add(CompletableFuture.runAsync(() -> store.setActive(a), pool));
                futures.add(CompletableFuture.runAsync(() -> other.create("n", ConnectionType.OLLAMA,
                        "http://localhost:11434", null, null, Map.of(), true), pool));
                futures.add(CompletableFuture.runAsync(() -> other.setActive(b), pool));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, activeIds().size());
    }
}
