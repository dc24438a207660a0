package tech.entragov.sdk.exception;

/**
 * Exception thrown when a connection-level failure persists after the network retry budget.
 */
public class NetworkException extends GraphException {

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }

    public static NetworkException interrupted(String path, InterruptedException cause) {
        return new NetworkException("Interrupted while waiting to retry " + path, cause);
    }
}
