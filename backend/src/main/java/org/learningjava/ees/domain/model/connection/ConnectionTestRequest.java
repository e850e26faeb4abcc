package org.learningjava.ees.domain.model.connection;

/**
 * Either an existing connection id, or an inline {@code type}/{@code baseUrl}/{@code apiKey}.
 * The id wins when both are present.
 */
public record ConnectionTestRequest(Long id, String type, String baseUrl, String apiKey) {

    public static ConnectionTestRequest forId(long id) {
        return new ConnectionTestRequest(id, null, null, null);
    }

    public static ConnectionTestRequest inline(String type, String baseUrl, String apiKey) {
        return new ConnectionTestRequest(null, type, baseUrl, apiKey);
    }
}
