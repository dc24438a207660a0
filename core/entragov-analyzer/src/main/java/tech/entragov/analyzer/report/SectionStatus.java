package tech.entragov.analyzer.report;

/**
 * Whether a report section was produced; {@code reason} is set when it was not.
 */
public record SectionStatus(
    State state,
    String reason
) {
    public enum State {
        OK,
        DEGRADED
    }

    private static final SectionStatus OK = new SectionStatus(State.OK, null);

    public static SectionStatus ok() {
        return OK;
    }

    public static SectionStatus degraded(String reason) {
        return new SectionStatus(State.DEGRADED, reason);
    }

    public boolean isOk() {
        return state == State.OK;
    }
}
