package tech.entragov.sdk.exception;

import java.time.Duration;

/**
 * Exception thrown when a request keeps timing out after the network retry budget.
 */
public class RequestTimeoutException extends GraphException {

    public RequestTimeoutException(String path, Duration timeout, Throwable cause) {
        super("Request to " + path + " timed out after " + timeout.toMillis() + "ms", cause);
    }
}
