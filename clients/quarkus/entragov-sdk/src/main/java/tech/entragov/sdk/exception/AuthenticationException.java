package tech.entragov.sdk.exception;

/**
 * Exception thrown when the credential exchange is rejected or a fresh token is refused.
 */
public class AuthenticationException extends GraphException {

    public AuthenticationException(String message) {
        super(message, 401);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, 401, cause, null);
    }

    public static AuthenticationException tokenRejected(String path) {
        return new AuthenticationException("Access token rejected twice for " + path);
    }

    public static AuthenticationException writeUnauthorized(String path) {
        return new AuthenticationException(
            "Write to " + path + " was rejected with 401; the cached token was invalidated"
        );
    }

    public static AuthenticationException invalidCredentials(String error, String description) {
        return new AuthenticationException("Token acquisition failed: " + error + " - " + description);
    }

    public static AuthenticationException missingCredentials() {
        return new AuthenticationException("Tenant ID, client ID and client secret are required");
    }
}
