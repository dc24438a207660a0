package tech.entragov.sdk.dto;

import tech.entragov.sdk.enums.GrantOperator;

import java.util.HashSet;
import java.util.Set;

/**
 * Grant controls of a Conditional Access policy.
 *
 * @param authenticationStrengthId id of the required authentication strength, null if none
 */
public record GrantControls(
    GrantOperator operator,
    Set<String> builtInControls,
    String authenticationStrengthId
) {
    public static final String BLOCK = "block";

    public static GrantControls none() {
        return new GrantControls(GrantOperator.OR, Set.of(), null);
    }

    public boolean blocks() {
        return builtInControls.contains(BLOCK);
    }

    /**
     * Whether the controls grant access subject to requirements (as opposed to blocking).
     */
    public boolean grants() {
        return !blocks() && (!builtInControls.isEmpty() || authenticationStrengthId != null);
    }

    /**
     * MFA, third-party MFA, or an authentication strength.
     */
    public boolean requiresMfa() {
        return builtInControls.contains("mfa")
            || builtInControls.contains("mfaFromOtherProvider")
            || authenticationStrengthId != null;
    }

    public boolean requiresCompliantDevice() {
        return builtInControls.contains("compliantDevice") || builtInControls.contains("domainJoinedDevice");
    }

    public boolean requiresAppProtection() {
        return builtInControls.contains("approvedApplication") || builtInControls.contains("compliantApplication");
    }

    /**
     * Every requirement of this policy, including the authentication strength.
     */
    public Set<String> requirements() {
        if (authenticationStrengthId == null) {
            return builtInControls;
        }
        Set<String> all = new HashSet<>(builtInControls);
        all.add("authenticationStrength:" + authenticationStrengthId);
        return Set.copyOf(all);
    }
}
