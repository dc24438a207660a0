package tech.entragov.sdk.client.paging;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of a list response, normalized from whichever envelope the endpoint uses.
 *
 * @param nextCursor absolute next link or opaque cursor, null on the last page
 */
public record Page(
    List<JsonNode> items,
    String nextCursor
) {
    private static final String[] ITEM_FIELDS = {"value", "items"};
    private static final String[] CURSOR_FIELDS = {"@odata.nextLink", "nextLink", "next_cursor"};

    public static Page empty() {
        return new Page(List.of(), null);
    }

    /**
     * Normalize a list response body.
     *
     * <ul>
     *   <li>{@code {"value"|"items": [...], "@odata.nextLink"|"nextLink"|"next_cursor": ...}}</li>
     *   <li>a bare JSON array, continued through the {@code X-Next-Cursor} header</li>
     *   <li>any other object, treated as a one-item page</li>
     * </ul>
     *
     * @param headerCursor value of the {@code X-Next-Cursor} header, may be null
     */
    public static Page from(JsonNode body, String headerCursor) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return new Page(List.of(), blankToNull(headerCursor));
        }
        if (body.isArray()) {
            return new Page(toList(body), blankToNull(headerCursor));
        }

        for (String field : ITEM_FIELDS) {
            JsonNode items = body.get(field);
            if (items != null && items.isArray()) {
                return new Page(toList(items), cursorOf(body, headerCursor));
            }
        }
        return new Page(List.of(body), null);
    }

    public boolean hasNext() {
        return nextCursor != null;
    }

    private static String cursorOf(JsonNode body, String headerCursor) {
        for (String field : CURSOR_FIELDS) {
            JsonNode cursor = body.get(field);
            if (cursor != null && cursor.isTextual() && !cursor.asText().isBlank()) {
                return cursor.asText();
            }
        }
        return blankToNull(headerCursor);
    }

    private static List<JsonNode> toList(JsonNode array) {
        List<JsonNode> items = new ArrayList<>(array.size());
        array.forEach(items::add);
        return List.copyOf(items);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
