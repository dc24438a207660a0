package tech.entragov.sdk.support;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Null-tolerant readers for Graph JSON payloads.
 */
public final class GraphJson {

    private GraphJson() {
    }

    /**
     * @return the text value of {@code field}, or null when missing, null or blank
     */
    public static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * Text of the nested {@code parent.field}, e.g. {@code principal.id}.
     */
    public static String nestedText(JsonNode node, String parent, String field) {
        return text(node.path(parent), field);
    }

    public static boolean bool(JsonNode node, String field) {
        return node.path(field).asBoolean(false);
    }

    /**
     * Parse an ISO-8601 timestamp field. Graph omits the offset on some endpoints;
     * such values are read as UTC.
     *
     * @return the instant, or null when the field is missing or unreadable
     */
    public static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value.endsWith("Z") ? value : value + "Z");
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    /**
     * Values of a string array field; missing or non-array fields yield an empty set.
     */
    public static Set<String> stringSet(JsonNode node, String field) {
        JsonNode array = node.path(field);
        if (!array.isArray()) {
            return Set.of();
        }
        Set<String> values = new LinkedHashSet<>();
        array.forEach(item -> {
            if (item.isTextual()) {
                values.add(item.asText());
            }
        });
        return Set.copyOf(values);
    }
}
