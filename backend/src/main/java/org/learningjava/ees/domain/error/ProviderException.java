package org.learningjava.ees.domain.error;

/**
 * Base of the provider error taxonomy. Adapters translate every backend failure into exactly one
 * of the four subclasses; nothing above the adapter layer sees HTTP status codes or client
 * library exceptions.
 */
public abstract class ProviderException extends RuntimeException {

    private final String provider;
    private final String modelName;
    private final String errorCode;

    protected ProviderException(String provider, String modelName, String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.modelName = modelName;
        this.errorCode = errorCode;
    }

    public String provider() { return provider; }

    /** Model the failing call was made for, may be null. */
    public String modelName() { return modelName; }

    /** Backend status or a symbolic code such as {@code RATE_LIMITED}, may be null. */
    public String errorCode() { return errorCode; }
}
