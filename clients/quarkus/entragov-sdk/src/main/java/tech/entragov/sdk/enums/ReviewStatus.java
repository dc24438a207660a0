package tech.entragov.sdk.enums;

/**
 * Access review instance status, collapsed from the Graph status strings.
 */
public enum ReviewStatus {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED;

    public static ReviewStatus fromGraph(String value) {
        if (value == null) {
            return NOT_STARTED;
        }
        return switch (value) {
            case "Completed", "Applied", "Applying", "AutoReviewed" -> COMPLETED;
            case "InProgress", "AutoReviewing", "Starting" -> IN_PROGRESS;
            default -> NOT_STARTED;
        };
    }
}
