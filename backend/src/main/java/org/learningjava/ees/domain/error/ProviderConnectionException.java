package org.learningjava.ees.domain.error;

/** Network or transport failure reaching the provider. Also the fallback for unclassified errors. */
public class ProviderConnectionException extends ProviderException {

    public ProviderConnectionException(String provider, String message, String errorCode, Throwable cause) {
        super(provider, null, message, errorCode, cause);
    }

    public ProviderConnectionException(String provider, String message, Throwable cause) {
        this(provider, message, "CONNECTION_ERROR", cause);
    }
}
