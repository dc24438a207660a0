package tech.entragov.sdk.enums;

/**
 * How the built-in grant controls of a policy combine.
 */
public enum GrantOperator {
    /** Every control is required */
    AND,

    /** Any one control satisfies the policy */
    OR;

    public static GrantOperator fromGraph(String value) {
        return "AND".equalsIgnoreCase(value) ? AND : OR;
    }
}
