package tech.entragov.sdk.exception;

import java.util.Map;

/**
 * Exception thrown when 5xx responses outlast the server-error retry budget.
 */
public class TransientServerException extends GraphException {

    public TransientServerException(String path, int statusCode, String body, int attempts) {
        super("Server error " + statusCode + " on " + path + " after " + attempts + " retries", statusCode, null,
            Map.of("path", path, "attempts", attempts, "body", body != null ? body : ""));
    }
}
