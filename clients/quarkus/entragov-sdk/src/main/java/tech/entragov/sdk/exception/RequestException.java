package tech.entragov.sdk.exception;

import java.util.Map;

/**
 * Exception thrown for non-retryable client errors (4xx other than 401 and 429).
 * Carries the response body for diagnostics.
 */
public class RequestException extends GraphException {

    private final String body;

    public RequestException(String method, String path, int statusCode, String body) {
        super(method + " " + path + " failed with HTTP " + statusCode, statusCode, null,
            Map.of("path", path, "method", method));
        this.body = body;
    }

    public String getBody() {
        return body;
    }
}
