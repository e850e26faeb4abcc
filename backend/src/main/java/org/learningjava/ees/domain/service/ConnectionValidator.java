package org.learningjava.ees.domain.service;

import org.learningjava.ees.domain.error.InvalidConnectionException;
import org.learningjava.ees.domain.model.provider.ConnectionType;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ConnectionValidator {

    // registry-style authority: java.net.URI leaves getHost() null for names like "ollama_server"
    private static final Pattern LOOSE_AUTHORITY = Pattern.compile("(?:[^@]*@)?([A-Za-z0-9._-]+)(?::\\d{1,5})?");

    public static ConnectionType requireType(String tag) {
        return ConnectionType.fromTag(tag)
                .orElseThrow(() -> new InvalidConnectionException("Unsupported connection type: " + tag));
    }

    /** Absolute http(s) URL with a host; trailing slashes are dropped. */
    public static String requireBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new InvalidConnectionException("baseUrl is required");
        }
        String trimmed = baseUrl.trim();
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new InvalidConnectionException("baseUrl must use http or https: " + baseUrl);
            }
            if (host(uri) == null) {
                throw new InvalidConnectionException("baseUrl has no host: " + baseUrl);
            }
        } catch (URISyntaxException e) {
            throw new InvalidConnectionException("baseUrl is not a valid URL: " + baseUrl);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    static String host(URI uri) {
        if (uri.getHost() != null && !uri.getHost().isBlank()) return uri.getHost();
        if (uri.getRawAuthority() == null) return null;
        Matcher m = LOOSE_AUTHORITY.matcher(uri.getRawAuthority());
        return m.matches() ? m.group(1) : null;
    }

    public static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidConnectionException("name is required");
        }
        return name.trim();
    }

    private ConnectionValidator() {}
}
