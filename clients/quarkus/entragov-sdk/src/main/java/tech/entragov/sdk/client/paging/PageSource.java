package tech.entragov.sdk.client.paging;

/**
 * Fetches the pages of one list endpoint.
 */
public interface PageSource {

    Page first();

    /**
     * @param cursor the {@link Page#nextCursor()} of the previous page
     */
    Page next(String cursor);
}
