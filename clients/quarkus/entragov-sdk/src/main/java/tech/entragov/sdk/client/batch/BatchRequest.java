package tech.entragov.sdk.client.batch;

import java.util.Map;

/**
 * One sub-request of a $batch call.
 *
 * @param path   path relative to the API version root, e.g. {@code users/abc}
 * @param params query parameters, appended in iteration order
 * @param body   JSON body for writes, null for reads
 */
public record BatchRequest(
    String method,
    String path,
    Map<String, String> params,
    Object body
) {
    public BatchRequest {
        params = params != null ? params : Map.of();
    }

    public static BatchRequest get(String path) {
        return new BatchRequest("GET", path, Map.of(), null);
    }

    public static BatchRequest get(String path, Map<String, String> params) {
        return new BatchRequest("GET", path, params, null);
    }

    public boolean isRead() {
        return "GET".equalsIgnoreCase(method);
    }
}
