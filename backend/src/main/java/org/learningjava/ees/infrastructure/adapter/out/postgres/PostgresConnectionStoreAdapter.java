package org.learningjava.ees.infrastructure.adapter.out.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.ees.application.port.ConnectionStorePort;
import org.learningjava.ees.domain.error.StorageException;
import org.learningjava.ees.domain.model.connection.Connection;
import org.learningjava.ees.domain.model.connection.ConnectionPatch;
import org.learningjava.ees.domain.model.provider.ConnectionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

public class PostgresConnectionStoreAdapter implements ConnectionStorePort {

    private static final Logger log = LoggerFactory.getLogger(PostgresConnectionStoreAdapter.class);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private static final String COLUMNS =
            "id, name, type, base_url, api_key, default_model, metadata, is_active, created_at, updated_at";

    // one statement: the target row becomes active, every other row inactive; no-op for a missing id
    private static final String ACTIVATE_SQL = """
            UPDATE connection_configs
               SET is_active = (id = :id),
                   updated_at = CASE WHEN id = :id OR is_active THEN now() ELSE updated_at END
             WHERE EXISTS (SELECT 1 FROM connection_configs WHERE id = :id)
            """;

    // transaction-scoped advisory lock shared by every instance writing to this database
    private static final long ACTIVATION_LOCK_KEY = 0x65657331L;

    private static final String INSERT_SQL = """
            INSERT INTO connection_configs (name, type, base_url, api_key, default_model, metadata, is_active)
            VALUES (:name, :type, :baseUrl, :apiKey, :defaultModel, CAST(:metadata AS jsonb), :active)
            RETURNING id
            """;

    private final JdbcClient jdbc;
    private final TransactionTemplate tx;
    private final ObjectMapper om;
    private final RowMapper<Connection> rowMapper = this::mapRow;
    // activation touches every row; serialize it inside this process before taking the database lock
    private final ReentrantLock activationLock = new ReentrantLock();

    public PostgresConnectionStoreAdapter(DataSource dataSource) {
        this(dataSource, new ObjectMapper());
    }

    public PostgresConnectionStoreAdapter(DataSource dataSource, ObjectMapper om) {
        Objects.requireNonNull(dataSource, "dataSource");
        this.jdbc = JdbcClient.create(dataSource);
        this.tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.om = Objects.requireNonNull(om, "om");
    }

    @Override
    public void ensureSchema() {
        run("ensureSchema", () -> {
            jdbc.sql("""
                    CREATE TABLE IF NOT EXISTS connection_configs (
                        id            BIGSERIAL PRIMARY KEY,
                        name          TEXT        NOT NULL,
                        type          TEXT        NOT NULL,
                        base_url      TEXT        NOT NULL,
                        api_key       TEXT,
                        default_model TEXT,
                        metadata      JSONB       NOT NULL DEFAULT '{}',
                        is_active     BOOLEAN     NOT NULL DEFAULT false,
                        created_at    TIMESTAMPTZ NOT NULL DEFAULT now(),
                        updated_at    TIMESTAMPTZ NOT NULL DEFAULT now(),
                        -- deferred so the single activation UPDATE may pass through two active rows
                        CONSTRAINT ex_connection_configs_single_active
                            EXCLUDE USING btree (is_active WITH =) WHERE (is_active) DEFERRABLE INITIALLY DEFERRED
                    )
                    """).update();
            jdbc.sql("CREATE INDEX IF NOT EXISTS idx_connection_configs_active ON connection_configs (is_active)")
                    .update();
            return null;
        });
        log.info("Connection schema ready");
    }

    @Override
    public Connection create(String name, ConnectionType type, String baseUrl, String apiKey, String defaultModel,
                             Map<String, Object> metadata, boolean active) {
        String json = toJson(metadata);
        Long id = withActivationLock(active, () -> run("create", () -> tx.execute(status -> {
            if (active) {
                lockActivation();
                jdbc.sql("UPDATE connection_configs SET is_active = false, updated_at = now() WHERE is_active")
                        .update();
            }
            return jdbc.sql(INSERT_SQL)
                    .param("name", name)
                    .param("type", type.tag())
                    .param("baseUrl", baseUrl)
                    .param("apiKey", apiKey)
                    .param("defaultModel", defaultModel)
                    .param("metadata", json)
                    .param("active", active)
                    .query(Long.class)
                    .single();
        })));
        log.info("Created connection id={} name='{}' type={} active={}", id, name, type, active);
        return findById(id).orElseThrow(() -> new StorageException("Connection " + id + " vanished after insert"));
    }

    @Override
    public Optional<Connection> update(long id, ConnectionPatch patch) {
        boolean activating = Boolean.TRUE.equals(patch.active());
        Boolean found = withActivationLock(activating, () -> run("update", () -> tx.execute(status -> {
            if (activating) lockActivation();
            Optional<Connection> current = jdbc.sql("SELECT " + COLUMNS + " FROM connection_configs WHERE id = :id FOR UPDATE")
                    .param("id", id)
                    .query(rowMapper)
                    .optional();
            if (current.isEmpty()) return false;
            Connection c = current.get();

            jdbc.sql("""
                    UPDATE connection_configs
                       SET name = :name, base_url = :baseUrl, api_key = :apiKey, default_model = :defaultModel,
                           metadata = CAST(:metadata AS jsonb), updated_at = now()
                     WHERE id = :id
                    """)
                    .param("id", id)
                    .param("name", patch.name() != null ? patch.name() : c.name())
                    .param("baseUrl", patch.baseUrl() != null ? patch.baseUrl() : c.baseUrl())
                    .param("apiKey", patch.apiKey() != null ? patch.apiKey() : c.apiKey())
                    .param("defaultModel", patch.defaultModel() != null ? patch.defaultModel() : c.defaultModel())
                    .param("metadata", toJson(patch.metadata() != null ? patch.metadata() : c.metadata()))
                    .update();

            if (activating) {
                jdbc.sql(ACTIVATE_SQL).param("id", id).update();
            } else if (Boolean.FALSE.equals(patch.active())) {
                jdbc.sql("UPDATE connection_configs SET is_active = false WHERE id = :id").param("id", id).update();
            }
            return true;
        })));
        return Boolean.TRUE.equals(found) ? findById(id) : Optional.empty();
    }

    @Override
    public boolean delete(long id) {
        int n = run("delete", () -> jdbc.sql("DELETE FROM connection_configs WHERE id = :id").param("id", id).update());
        if (n > 0) log.info("Deleted connection id={}", id);
        return n > 0;
    }

    @Override
    public Optional<Connection> findById(long id) {
        return run("findById", () -> jdbc.sql("SELECT " + COLUMNS + " FROM connection_configs WHERE id = :id")
                .param("id", id)
                .query(rowMapper)
                .optional());
    }

    @Override
    public List<Connection> findAll() {
        return run("findAll", () -> jdbc.sql("SELECT " + COLUMNS
                        + " FROM connection_configs ORDER BY created_at DESC, id DESC")
                .query(rowMapper)
                .list());
    }

    @Override
    public Optional<Connection> findActive() {
        return run("findActive", () -> jdbc.sql("SELECT " + COLUMNS
                        + " FROM connection_configs WHERE is_active ORDER BY updated_at DESC, id DESC LIMIT 1")
                .query(rowMapper)
                .optional());
    }

    @Override
    public boolean setActive(long id) {
        Integer touched = withActivationLock(true, () -> run("setActive", () -> tx.execute(status -> {
            lockActivation();
            return jdbc.sql(ACTIVATE_SQL).param("id", id).update();
        })));
        boolean done = touched != null && touched > 0;
        if (done) log.info("Connection id={} is now active", id);
        return done;
    }

    // ---- helpers ----

    private void lockActivation() {
        jdbc.sql("SELECT pg_advisory_xact_lock(:key)").param("key", ACTIVATION_LOCK_KEY).query().listOfRows();
    }

    private <T> T withActivationLock(boolean needed, Supplier<T> op) {
        if (!needed) return op.get();
        activationLock.lock();
        try {
            return op.get();
        } finally {
            activationLock.unlock();
        }
    }

    private static <T> T run(String label, Supplier<T> op) {
        try {
            return op.get();
        } catch (DataAccessException e) {
            log.error("Connection store '{}' failed: {}", label, e.getMostSpecificCause().getMessage());
            throw new StorageException("Connection store operation '" + label + "' failed: "
                    + e.getMostSpecificCause().getMessage(), label, e);
        }
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return om.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new StorageException("Connection metadata is not serializable: " + e.getOriginalMessage(), null, e);
        }
    }

    private Connection mapRow(ResultSet rs, int rowNum) throws SQLException {
        String tag = rs.getString("type");
        ConnectionType type = ConnectionType.fromTag(tag)
                .orElseThrow(() -> new StorageException("Unknown connection type stored: " + tag));
        return new Connection(
                rs.getLong("id"),
                rs.getString("name"),
                type,
                rs.getString("base_url"),
                rs.getString("api_key"),
                rs.getString("default_model"),
                readMetadata(rs.getString("metadata")),
                rs.getBoolean("is_active"),
                instant(rs.getTimestamp("created_at")),
                instant(rs.getTimestamp("updated_at"))
        );
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return om.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new StorageException("Stored connection metadata is not valid JSON", null, e);
        }
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
