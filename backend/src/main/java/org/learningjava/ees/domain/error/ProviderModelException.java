package org.learningjava.ees.domain.error;

/** Requested model is unknown, unsupported or misconfigured, or the provider rejected the request body. */
public class ProviderModelException extends ProviderException {

    public ProviderModelException(String provider, String modelName, String message, String errorCode, Throwable cause) {
        super(provider, modelName, message, errorCode, cause);
    }

    public ProviderModelException(String provider, String modelName, String message) {
        this(provider, modelName, message, "MODEL_ERROR", null);
    }
}
