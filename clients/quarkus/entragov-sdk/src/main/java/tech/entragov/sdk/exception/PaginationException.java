package tech.entragov.sdk.exception;

/**
 * Exception thrown when a continuation chain exceeds the page or item safety cap.
 */
public class PaginationException extends GraphException {

    public PaginationException(String message) {
        super(message);
    }

    public static PaginationException tooManyPages(String path, int maxPages) {
        return new PaginationException(
            "Continuation chain for " + path + " exceeded " + maxPages + " pages"
        );
    }

    public static PaginationException tooManyItems(String path, int maxItems) {
        return new PaginationException(
            "Continuation chain for " + path + " exceeded " + maxItems + " items"
        );
    }
}
