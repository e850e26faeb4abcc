package org.learningjava.ees.domain.error;

/** Connection input rejected before it reached the store: bad URL, unknown type, missing name. */
public class InvalidConnectionException extends IllegalArgumentException {

    public InvalidConnectionException(String message) {
        super(message);
    }
}
