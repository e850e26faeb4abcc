package org.learningjava.ees.domain.error;

public class ConnectionNotFoundException extends RuntimeException {

    private final long connectionId;

    public ConnectionNotFoundException(long connectionId) {
        super("Connection with id " + connectionId + " not found");
        this.connectionId = connectionId;
    }

    public long connectionId() { return connectionId; }
}
