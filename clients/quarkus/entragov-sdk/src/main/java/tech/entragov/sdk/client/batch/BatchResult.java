package tech.entragov.sdk.client.batch;

import com.fasterxml.jackson.databind.JsonNode;
import tech.entragov.sdk.exception.GraphException;

/**
 * Outcome of one $batch sub-request. Exactly one of {@code body} and {@code error}
 * is set; a failed sub-request never affects its siblings.
 */
public record BatchResult(
    int statusCode,
    JsonNode body,
    GraphException error
) {
    public static BatchResult success(int statusCode, JsonNode body) {
        return new BatchResult(statusCode, body, null);
    }

    public static BatchResult failure(GraphException error) {
        return new BatchResult(error.getStatusCode(), null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the response body
     * @throws GraphException the sub-request's failure
     */
    public JsonNode bodyOrThrow() {
        if (error != null) {
            throw error;
        }
        return body;
    }
}
