package tech.entragov.sdk.exception;

import java.util.Map;

/**
 * Exception thrown when throttling responses outlast the rate-limit retry budget.
 */
public class RateLimitExceededException extends GraphException {

    public RateLimitExceededException(String path, int statusCode, int attempts) {
        super("Rate limited on " + path + " after " + attempts + " retries", statusCode, null,
            Map.of("path", path, "attempts", attempts));
    }
}
