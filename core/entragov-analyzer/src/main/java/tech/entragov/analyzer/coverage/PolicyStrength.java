package tech.entragov.analyzer.coverage;

import tech.entragov.sdk.dto.GrantControls;
import tech.entragov.sdk.dto.Policy;
import tech.entragov.sdk.enums.GrantOperator;

/**
 * Scores a single policy by the controls it enforces.
 */
final class PolicyStrength {

    static final int MFA = 25;
    static final int DEVICE_COMPLIANCE = 20;
    static final int LEGACY_AUTH = 20;
    static final int LOCATION = 15;
    static final int APP_PROTECTION = 10;
    static final int SESSION = 10;

    private PolicyStrength() {
    }

    static PolicyScore score(Policy policy) {
        GrantControls grant = policy.grantControls();
        int score = 0;

        if (grant.requiresMfa()) {
            score += MFA;
        }
        if (grant.requiresCompliantDevice()) {
            score += DEVICE_COMPLIANCE;
        }
        score += legacyAuthScore(policy);
        if (policy.conditions().hasLocationConditions()) {
            score += LOCATION;
        }
        if (grant.requiresAppProtection()) {
            score += APP_PROTECTION;
        }
        if (policy.hasSessionControls()) {
            score += SESSION;
        }
        return new PolicyScore(policy.id(), policy.displayName(), Math.min(score, 100));
    }

    /**
     * Full credit when legacy clients are blocked or not singled out, half when they
     * are targeted with an OR grant, none otherwise.
     */
    private static int legacyAuthScore(Policy policy) {
        if (!policy.conditions().targetsLegacyClients() || policy.grantControls().blocks()) {
            return LEGACY_AUTH;
        }
        return policy.grantControls().operator() == GrantOperator.OR ? LEGACY_AUTH / 2 : 0;
    }
}
