package tech.entragov.sdk.dto;

import java.util.Set;

/**
 * Applications a policy applies to, by app id. {@code All} targets every application.
 */
public record ApplicationScope(
    Set<String> includeApplications,
    Set<String> excludeApplications
) {
    public static final String ALL = "All";

    public static ApplicationScope empty() {
        return new ApplicationScope(Set.of(), Set.of());
    }

    public boolean includesAll() {
        return includeApplications.contains(ALL);
    }

    public boolean matches(String appId) {
        return !excludeApplications.contains(appId)
            && (includesAll() || includeApplications.contains(appId));
    }
}
