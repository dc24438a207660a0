package tech.entragov.sdk.client;

import java.net.http.HttpHeaders;
import java.util.List;
import java.util.Map;

/**
 * Status, headers and raw body of one HTTP exchange (or one $batch sub-response).
 */
public record ApiResponse(
    int statusCode,
    HttpHeaders headers,
    String body
) {
    public static ApiResponse of(int statusCode, Map<String, List<String>> headers, String body) {
        return new ApiResponse(statusCode, HttpHeaders.of(headers, (name, value) -> true), body);
    }

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }
}
