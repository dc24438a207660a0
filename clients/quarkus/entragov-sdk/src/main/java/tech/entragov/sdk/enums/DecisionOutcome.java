package tech.entragov.sdk.enums;

/**
 * Access review decision.
 */
public enum DecisionOutcome {
    APPROVE("Approve"),
    DENY("Deny"),
    DONT_KNOW("DontKnow"),

    /** Not reviewed yet */
    NONE("NotReviewed");

    private final String graphValue;

    DecisionOutcome(String graphValue) {
        this.graphValue = graphValue;
    }

    public String graphValue() {
        return graphValue;
    }

    public boolean isDecided() {
        return this != NONE;
    }

    public static DecisionOutcome fromGraph(String value) {
        for (DecisionOutcome outcome : values()) {
            if (outcome.graphValue.equalsIgnoreCase(value)) {
                return outcome;
            }
        }
        return NONE;
    }
}
