package tech.entragov.sdk.dto;

import java.util.Set;

/**
 * Targeting conditions of a Conditional Access policy.
 */
public record PolicyConditions(
    UserScope users,
    ApplicationScope applications,
    Set<String> includeLocations,
    Set<String> excludeLocations,
    Set<String> clientAppTypes,
    Set<String> userRiskLevels,
    Set<String> signInRiskLevels
) {
    public static PolicyConditions empty() {
        return new PolicyConditions(UserScope.empty(), ApplicationScope.empty(),
            Set.of(), Set.of(), Set.of(), Set.of(), Set.of());
    }

    public boolean hasLocationConditions() {
        return !includeLocations.isEmpty() || !excludeLocations.isEmpty();
    }

    /**
     * Whether the policy targets legacy authentication clients.
     */
    public boolean targetsLegacyClients() {
        return clientAppTypes.contains("exchangeActiveSync") || clientAppTypes.contains("other");
    }
}
