package tech.entragov.sdk.dto;

import tech.entragov.sdk.enums.PolicyState;

import java.time.Instant;
import java.util.Set;

/**
 * A Conditional Access policy, as fetched.
 *
 * @param sessionControls names of the configured session controls, e.g. {@code signInFrequency}
 */
public record Policy(
    String id,
    String displayName,
    PolicyState state,
    PolicyConditions conditions,
    GrantControls grantControls,
    Set<String> sessionControls,
    Instant modifiedAt
) {
    public boolean isEnabled() {
        return state == PolicyState.ENABLED;
    }

    public boolean hasSessionControls() {
        return !sessionControls.isEmpty();
    }
}
