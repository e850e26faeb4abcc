package org.learningjava.ees.domain.error;

/**
 * Persistence failure in the embedding or connection store. Carries the statement (or a short
 * label of it) when one was involved.
 */
public class StorageException extends RuntimeException {

    private final String query;

    public StorageException(String message, String query, Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    public StorageException(String message) {
        this(message, null, null);
    }

    public String query() { return query; }
}
