package tech.entragov.sdk.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the unchecked exceptions raised by the Graph access layer.
 *
 * <p>{@link #getStatusCode()} is the HTTP status that ended the call, or {@link #NO_STATUS}
 * when no response was received (network failures, timeouts, paging caps). The context
 * map carries request details such as the retry count or the response body.
 */
public class GraphException extends RuntimeException {

    public static final int NO_STATUS = 0;

    private final int statusCode;
    private final Map<String, Object> context;

    public GraphException(String message) {
        this(message, NO_STATUS, null, null);
    }

    public GraphException(String message, int statusCode) {
        this(message, statusCode, null, null);
    }

    public GraphException(String message, Throwable cause) {
        this(message, NO_STATUS, cause, null);
    }

    public GraphException(String message, int statusCode, Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.statusCode = statusCode;
        this.context = context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return true when the failure was reported by an HTTP response
     */
    public boolean hasResponse() {
        return statusCode != NO_STATUS;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
