package org.learningjava.ees.infrastructure.adapter.out.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.ees.domain.error.ProviderAuthenticationException;
import org.learningjava.ees.domain.error.ProviderConnectionException;
import org.learningjava.ees.domain.error.ProviderException;
import org.learningjava.ees.domain.error.ProviderModelException;
import org.learningjava.ees.domain.error.ProviderRateLimitException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;

/**
 * Maps raw HTTP outcomes of a provider call onto the error taxonomy. Shared by all adapters so
 * that a 401 means the same thing whichever backend sent it.
 */
public final class ProviderErrorMapper {

    private static final ObjectMapper om = new ObjectMapper();

    private final String provider;

    public ProviderErrorMapper(String provider) {
        this.provider = provider;
    }

    /**
     * @param retryAfter raw {@code Retry-After} header, may be null
     */
    public ProviderException fromStatus(int status, String body, String modelName, String retryAfter, Throwable cause) {
        String detail = extractMessage(body);
        String lower = detail.toLowerCase(Locale.ROOT);

        if (status == 401 || status == 403) {
            return new ProviderAuthenticationException(provider,
                    "Authentication failed: " + detail, String.valueOf(status), cause);
        }
        if (status == 429) {
            return new ProviderRateLimitException(provider,
                    "Rate limit exceeded: " + detail, parseRetryAfter(retryAfter), cause);
        }
        if (status == 404 || (lower.contains("model") && lower.contains("not found"))) {
            return new ProviderModelException(provider, modelName,
                    "Model not found: " + detail, "MODEL_NOT_FOUND", cause);
        }
        if (status == 400 || status == 422) {
            return new ProviderModelException(provider, modelName,
                    "Request rejected by " + provider + ": " + detail, String.valueOf(status), cause);
        }
        return new ProviderConnectionException(provider,
                provider + " API error (HTTP " + status + "): " + detail, String.valueOf(status), cause);
    }

    /** Transport level failure: refused, unknown host, timeout, reset. */
    public ProviderException fromTransport(Exception e, String baseUrl) {
        // RestTemplate wraps the socket exception in ResourceAccessException
        Throwable t = !(e instanceof IOException) && e.getCause() instanceof IOException ? e.getCause() : e;
        String code;
        if (t instanceof SocketTimeoutException || t instanceof InterruptedIOException) {
            code = "TIMEOUT";
        } else if (t instanceof ConnectException || t instanceof UnknownHostException) {
            code = "CONNECTION_REFUSED";
        } else {
            code = "CONNECTION_ERROR";
        }
        return new ProviderConnectionException(provider,
                "Cannot reach " + provider + " at " + baseUrl + ": " + oneLine(e), code, e);
    }

    /** Anything that did not fit above. */
    public ProviderException unclassified(Exception e) {
        if (e instanceof ProviderException pe) return pe;
        return new ProviderConnectionException(provider,
                "Unexpected " + provider + " error: " + oneLine(e), "UNKNOWN_ERROR", e);
    }

    static Long parseRetryAfter(String header) {
        if (header == null || header.isBlank()) return null;
        try {
            long s = Long.parseLong(header.trim());
            return s >= 0 ? s : null;
        } catch (NumberFormatException e) {
            // HTTP-date form is not worth the parsing here
            return null;
        }
    }

    /** Pulls a readable message out of the usual {"error": "..."} / {"error": {"message": "..."}} shapes. */
    static String extractMessage(String body) {
        if (body == null || body.isBlank()) return "(empty body)";
        try {
            JsonNode json = om.readTree(body);
            JsonNode err = json.path("error");
            if (err.isTextual()) return err.asText();
            if (err.path("message").isTextual()) return err.path("message").asText();
            if (json.path("message").isTextual()) return json.path("message").asText();
        } catch (JsonProcessingException notJson) {
            // not JSON, fall through to the raw text
        }
        String s = body.replaceAll("\\s+", " ").trim();
        return s.length() > 300 ? s.substring(0, 300) + "..." : s;
    }

    private static String oneLine(Exception e) {
        String msg = e.getMessage();
        if (msg == null) msg = e.toString();
        return msg.replaceAll("\\s+", " ").trim();
    }
}
