package tech.entragov.sdk.enums;

/**
 * Conditional Access policy state.
 */
public enum PolicyState {
    ENABLED,

    DISABLED,

    /** Evaluated and logged, not enforced */
    REPORT_ONLY;

    public static PolicyState fromGraph(String value) {
        if (value == null) {
            return DISABLED;
        }
        return switch (value) {
            case "enabled" -> ENABLED;
            case "enabledForReportingButNotEnforced" -> REPORT_ONLY;
            default -> DISABLED;
        };
    }
}
