package org.learningjava.ees.infrastructure.adapter.out.postgres;

import org.learningjava.ees.application.port.EmbeddingStorePort;
import org.learningjava.ees.domain.error.StorageException;
import org.learningjava.ees.domain.model.embedding.EmbeddingFilter;
import org.learningjava.ees.domain.model.embedding.EmbeddingPage;
import org.learningjava.ees.domain.model.embedding.EmbeddingRecord;
import org.learningjava.ees.domain.model.embedding.SimilarEmbedding;
import org.learningjava.ees.domain.model.embedding.SimilarityQuery;
import org.learningjava.ees.domain.model.embedding.UriMatch;
import org.learningjava.ees.domain.service.SimilarityRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Embeddings table on plain PostgreSQL. Vectors live in a {@code real[]} column; similarity is
 * computed in the JVM by {@link SimilarityRanker} over the rows of the requested model.
 */
public class PostgresEmbeddingStoreAdapter implements EmbeddingStorePort {

    private static final Logger log = LoggerFactory.getLogger(PostgresEmbeddingStoreAdapter.class);

    private static final String COLUMNS = "id, uri, model_name, text, embedding, created_at, updated_at";

    private static final String UPSERT_SQL = """
            INSERT INTO embeddings (uri, model_name, text, embedding)
            VALUES (:uri, :model, :text, CAST(:embedding AS real[]))
            ON CONFLICT (uri, model_name) DO UPDATE
               SET text = EXCLUDED.text,
                   embedding = EXCLUDED.embedding,
                   updated_at = now()
            RETURNING id
            """;

    private static final String UPDATE_SQL = """
            UPDATE embeddings
               SET text = :text, embedding = CAST(:embedding AS real[]), updated_at = now()
             WHERE id = :id
            """;

    // dimension of any other row of the same model; one row is enough since all of them agree
    private static final String STORED_DIM_SQL = """
            SELECT cardinality(embedding) FROM embeddings
             WHERE model_name = :model AND uri <> :uri
             LIMIT 1
            """;

    private static final String STORED_DIM_BY_ID_SQL = """
            SELECT cardinality(e.embedding) FROM embeddings e
             WHERE e.model_name = (SELECT model_name FROM embeddings WHERE id = :id)
               AND e.id <> :id
             LIMIT 1
            """;

    // namespace for the per-model advisory locks taken around the dimension check
    private static final int DIMENSION_LOCK_CLASS = 0x656d62;

    private final JdbcClient jdbc;
    private final TransactionTemplate tx;
    private final SimilarityRanker ranker;

    public PostgresEmbeddingStoreAdapter(DataSource dataSource) {
        this(dataSource, new SimilarityRanker());
    }

    public PostgresEmbeddingStoreAdapter(DataSource dataSource, SimilarityRanker ranker) {
        Objects.requireNonNull(dataSource, "dataSource");
        this.jdbc = JdbcClient.create(dataSource);
        this.tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.ranker = Objects.requireNonNull(ranker, "ranker");
    }

    @Override
    public void ensureSchema() {
        run("ensureSchema", () -> {
            jdbc.sql("""
                    CREATE TABLE IF NOT EXISTS embeddings (
                        id          BIGSERIAL PRIMARY KEY,
                        uri         TEXT        NOT NULL,
                        model_name  TEXT        NOT NULL,
                        text        TEXT        NOT NULL,
                        embedding   REAL[]      NOT NULL,
                        created_at  TIMESTAMPTZ NOT NULL DEFAULT now(),
                        updated_at  TIMESTAMPTZ NOT NULL DEFAULT now(),
                        CONSTRAINT uq_embeddings_uri_model UNIQUE (uri, model_name)
                    )
                    """).update();
            jdbc.sql("CREATE INDEX IF NOT EXISTS idx_embeddings_model_name ON embeddings (model_name)").update();
            jdbc.sql("CREATE INDEX IF NOT EXISTS idx_embeddings_uri ON embeddings (uri)").update();
            return null;
        });
        log.info("Embeddings schema ready");
    }

    @Override
    public long save(String uri, String text, String modelName, float[] embedding) {
        requireText(uri, "uri");
        requireText(modelName, "modelName");
        Objects.requireNonNull(text, "text");
        String literal = toArrayLiteral(embedding);

        Long id = run("upsert", () -> tx.execute(status -> {
            lockModel(modelName);
            Integer stored = jdbc.sql(STORED_DIM_SQL)
                    .param("model", modelName)
                    .param("uri", uri)
                    .query(Integer.class)
                    .optional()
                    .orElse(null);
            checkDimension(stored, embedding.length, modelName);

            return jdbc.sql(UPSERT_SQL)
                    .param("uri", uri)
                    .param("model", modelName)
                    .param("text", text)
                    .param("embedding", literal)
                    .query(Long.class)
                    .single();
        }));
        log.debug("Saved embedding id={} uri={} model={} dim={}", id, uri, modelName, embedding.length);
        return id;
    }

    @Override
    public boolean updateById(long id, String text, float[] embedding) {
        Objects.requireNonNull(text, "text");
        String literal = toArrayLiteral(embedding);

        Integer updated = run("updateById", () -> tx.execute(status -> {
            jdbc.sql("SELECT pg_advisory_xact_lock(:cls, hashtext(model_name)) FROM embeddings WHERE id = :id")
                    .param("cls", DIMENSION_LOCK_CLASS)
                    .param("id", id)
                    .query().listOfRows();
            Integer stored = jdbc.sql(STORED_DIM_BY_ID_SQL)
                    .param("id", id)
                    .query(Integer.class)
                    .optional()
                    .orElse(null);
            checkDimension(stored, embedding.length, "id " + id);

            return jdbc.sql(UPDATE_SQL)
                    .param("id", id)
                    .param("text", text)
                    .param("embedding", literal)
                    .update();
        }));
        return updated != null && updated > 0;
    }

    /** Serializes check-then-write per model across connections until the transaction ends. */
    private void lockModel(String modelName) {
        jdbc.sql("SELECT pg_advisory_xact_lock(:cls, hashtext(:model))")
                .param("cls", DIMENSION_LOCK_CLASS)
                .param("model", modelName)
                .query().listOfRows();
    }

    @Override
    public boolean deleteById(long id) {
        return run("deleteById", () -> jdbc.sql("DELETE FROM embeddings WHERE id = :id")
                .param("id", id)
                .update()) > 0;
    }

    @Override
    public int deleteAll() {
        int n = run("deleteAll", () -> jdbc.sql("DELETE FROM embeddings").update());
        log.info("Deleted {} embeddings", n);
        return n;
    }

    @Override
    public Optional<EmbeddingRecord> findById(long id) {
        return run("findById", () -> jdbc.sql("SELECT " + COLUMNS + " FROM embeddings WHERE id = :id")
                .param("id", id)
                .query(EmbeddingRowMapper.INSTANCE)
                .optional());
    }

    @Override
    public Optional<EmbeddingRecord> findByUri(String uri, String modelName) {
        return run("findByUri", () -> jdbc.sql("SELECT " + COLUMNS
                        + " FROM embeddings WHERE uri = :uri AND model_name = :model")
                .param("uri", uri)
                .param("model", modelName)
                .query(EmbeddingRowMapper.INSTANCE)
                .optional());
    }

    @Override
    public EmbeddingPage findAll(EmbeddingFilter filter) {
        StringBuilder where = new StringBuilder(" WHERE 1=1");
        Map<String, Object> params = new LinkedHashMap<>();
        if (filter.uri() != null) {
            if (filter.uriMatch() == UriMatch.PREFIX) {
                // escape LIKE wildcards so the prefix is taken literally
                where.append(" AND uri LIKE :uriPrefix ESCAPE '\\'");
                params.put("uriPrefix", escapeLike(filter.uri()) + "%");
            } else {
                where.append(" AND uri = :uri");
                params.put("uri", filter.uri());
            }
        }
        if (filter.modelName() != null) {
            where.append(" AND model_name = :model");
            params.put("model", filter.modelName());
        }

        long total = run("count", () -> jdbc.sql("SELECT count(*) FROM embeddings" + where)
                .params(params)
                .query(Long.class)
                .single());

        Map<String, Object> pageParams = new LinkedHashMap<>(params);
        pageParams.put("limit", filter.limit());
        pageParams.put("offset", filter.offset());
        List<EmbeddingRecord> rows = run("findAll", () -> jdbc.sql("SELECT " + COLUMNS + " FROM embeddings" + where
                        + " ORDER BY created_at DESC, id DESC LIMIT :limit OFFSET :offset")
                .params(pageParams)
                .query(EmbeddingRowMapper.INSTANCE)
                .list());

        return EmbeddingPage.of(rows, filter.page(), filter.limit(), total);
    }

    @Override
    public List<String> listModelNames() {
        return run("listModelNames", () -> jdbc.sql("SELECT DISTINCT model_name FROM embeddings ORDER BY model_name")
                .query(String.class)
                .list());
    }

    @Override
    public List<SimilarEmbedding> searchSimilar(SimilarityQuery query) {
        List<EmbeddingRecord> candidates = run("searchSimilar", () -> jdbc.sql("SELECT " + COLUMNS
                        + " FROM embeddings WHERE model_name = :model")
                .param("model", query.modelName())
                .query(EmbeddingRowMapper.INSTANCE)
                .list());
        if (candidates.isEmpty()) return List.of();

        List<SimilarEmbedding> ranked = ranker.rank(query, candidates);
        log.debug("searchSimilar model={} metric={} candidates={} hits={}",
                query.modelName(), query.metric(), candidates.size(), ranked.size());
        return ranked;
    }

    // ---- helpers ----

    private static <T> T run(String label, Supplier<T> op) {
        try {
            return op.get();
        } catch (DataAccessException e) {
            log.error("Embedding store '{}' failed: {}", label, e.getMostSpecificCause().getMessage());
            throw new StorageException("Embedding store operation '" + label + "' failed: "
                    + e.getMostSpecificCause().getMessage(), label, e);
        }
    }

    private static void checkDimension(Integer stored, int given, String scope) {
        if (stored != null && stored != given) {
            throw new StorageException("Dimension mismatch for " + scope + ": stored vectors have "
                    + stored + " dimensions, got " + given);
        }
    }

    /** Renders the {@code {a,b,c}} text form accepted by a {@code real[]} cast. */
    static String toArrayLiteral(float[] v) {
        if (v == null || v.length == 0) {
            throw new StorageException("Embedding vector must not be empty");
        }
        StringBuilder sb = new StringBuilder(v.length * 10).append('{');
        for (int i = 0; i < v.length; i++) {
            if (!Float.isFinite(v[i])) {
                throw new StorageException("Embedding vector contains a non-finite value at index " + i);
            }
            if (i > 0) sb.append(',');
            sb.append(v[i]);
        }
        return sb.append('}').toString();
    }

    private static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static void requireText(String s, String name) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException(name + " must not be blank");
    }

    private enum EmbeddingRowMapper implements RowMapper<EmbeddingRecord> {
        INSTANCE;

        @Override
        public EmbeddingRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new EmbeddingRecord(
                    rs.getLong("id"),
                    rs.getString("uri"),
                    rs.getString("model_name"),
                    rs.getString("text"),
                    toFloats(rs.getArray("embedding")),
                    instant(rs.getTimestamp("created_at")),
                    instant(rs.getTimestamp("updated_at"))
            );
        }

        private static float[] toFloats(Array array) throws SQLException {
            if (array == null) return new float[0];
            Object[] boxed = (Object[]) array.getArray();
            float[] v = new float[boxed.length];
            for (int i = 0; i < boxed.length; i++) {
                v[i] = boxed[i] == null ? 0f : ((Number) boxed[i]).floatValue();
            }
            array.free();
            return v;
        }

        private static Instant instant(Timestamp ts) {
            return ts == null ? null : ts.toInstant();
        }
    }
}
