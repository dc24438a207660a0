package tech.entragov.sdk.client;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

/**
 * Classification of one attempt against the Graph API.
 *
 * <p>The retry loop in {@link GraphClient} and the $batch demultiplexer handle every
 * variant explicitly:
 * <ul>
 *   <li>{@link Success} - 2xx</li>
 *   <li>{@link AuthExpired} - 401, refresh the token and retry once</li>
 *   <li>{@link RateLimited} - 429, or 503 carrying Retry-After</li>
 *   <li>{@link TransientError} - any other 5xx</li>
 *   <li>{@link ClientError} - any other non-2xx, never retried</li>
 *   <li>{@link NetworkFailure} - no response at all (connection failure or timeout)</li>
 * </ul>
 */
public sealed interface ResponseOutcome permits
    ResponseOutcome.Success,
    ResponseOutcome.AuthExpired,
    ResponseOutcome.RateLimited,
    ResponseOutcome.TransientError,
    ResponseOutcome.ClientError,
    ResponseOutcome.NetworkFailure {

    static ResponseOutcome classify(ApiResponse response, Instant now) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return new Success(response);
        }
        if (status == 401) {
            return new AuthExpired(response);
        }

        var retryAfterHeader = response.headers().firstValue("Retry-After");
        if (status == 429 || (status == 503 && retryAfterHeader.isPresent())) {
            return new RateLimited(status, RetryAfter.parse(retryAfterHeader.orElse(null), now));
        }
        if (status >= 500) {
            return new TransientError(status, response.body());
        }
        return new ClientError(status, response.body());
    }

    record Success(ApiResponse response) implements ResponseOutcome {}

    record AuthExpired(ApiResponse response) implements ResponseOutcome {}

    /**
     * @param retryAfter wait requested by the server, null when it sent none
     */
    record RateLimited(int statusCode, Duration retryAfter) implements ResponseOutcome {}

    record TransientError(int statusCode, String body) implements ResponseOutcome {}

    record ClientError(int statusCode, String body) implements ResponseOutcome {}

    /**
     * @param timeout true when the request timed out rather than failing to connect
     */
    record NetworkFailure(IOException cause, boolean timeout) implements ResponseOutcome {}
}
