package org.learningjava.ees.domain.error;

/** Credential missing, invalid or expired. */
public class ProviderAuthenticationException extends ProviderException {

    public ProviderAuthenticationException(String provider, String message, String errorCode, Throwable cause) {
        super(provider, null, message, errorCode, cause);
    }
}
