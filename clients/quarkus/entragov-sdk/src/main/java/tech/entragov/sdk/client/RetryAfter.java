package tech.entragov.sdk.client;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parses the {@code Retry-After} header, which is either delta-seconds or an HTTP-date.
 */
final class RetryAfter {

    private static final Logger LOG = Logger.getLogger(RetryAfter.class);

    private RetryAfter() {
    }

    /**
     * @return the wait requested by the server, or null if the value is absent or unreadable
     */
    static Duration parse(String value, Instant now) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return Duration.ofSeconds(Math.max(0, Long.parseLong(trimmed)));
        } catch (NumberFormatException e) {
            try {
                Instant until = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
                Duration wait = Duration.between(now, until);
                return wait.isNegative() ? Duration.ZERO : wait;
            } catch (DateTimeParseException dateError) {
                LOG.debugf("Ignoring unreadable Retry-After header '%s'", trimmed);
                return null;
            }
        }
    }
}
