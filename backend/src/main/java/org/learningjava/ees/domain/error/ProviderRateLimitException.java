package org.learningjava.ees.domain.error;

/** Provider signalled throttling. */
public class ProviderRateLimitException extends ProviderException {

    private final Long retryAfterSeconds;

    public ProviderRateLimitException(String provider, String message, Long retryAfterSeconds, Throwable cause) {
        super(provider, null, message, "RATE_LIMITED", cause);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    /** Seconds the provider asked us to wait, null when it did not say. */
    public Long retryAfterSeconds() { return retryAfterSeconds; }
}
