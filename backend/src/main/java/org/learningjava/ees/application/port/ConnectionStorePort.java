package org.learningjava.ees.application.port;

import org.learningjava.ees.domain.model.connection.Connection;
import org.learningjava.ees.domain.model.connection.ConnectionPatch;
import org.learningjava.ees.domain.model.provider.ConnectionType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Persistence for connections. Input is already validated by the caller. */
public interface ConnectionStorePort {
    void ensureSchema();

    /** Inserts a row; when {@code active} is true all other rows are deactivated in the same transaction. */
    Connection create(String name, ConnectionType type, String baseUrl, String apiKey, String defaultModel,
                      Map<String, Object> metadata, boolean active);

    /** Applies the non-null fields of {@code patch}; empty when the id does not exist. */
    Optional<Connection> update(long id, ConnectionPatch patch);

    boolean delete(long id);

    Optional<Connection> findById(long id);

    /** Newest first. */
    List<Connection> findAll();

    Optional<Connection> findActive();

    /**
     * Marks {@code id} active and every other row inactive in one atomic statement, serialized across instances.
     *
     * @return false when the id does not exist (nothing changed)
     */
    boolean setActive(long id);
}
