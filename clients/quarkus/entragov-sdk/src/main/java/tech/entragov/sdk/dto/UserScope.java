package tech.entragov.sdk.dto;

import java.util.Set;

/**
 * Users a policy applies to. The special value {@code All} in {@code includeUsers}
 * targets every user.
 */
public record UserScope(
    Set<String> includeUsers,
    Set<String> excludeUsers,
    Set<String> includeGroups,
    Set<String> excludeGroups,
    Set<String> includeRoles,
    Set<String> excludeRoles
) {
    public static final String ALL = "All";

    public static UserScope empty() {
        return new UserScope(Set.of(), Set.of(), Set.of(), Set.of(), Set.of(), Set.of());
    }

    public boolean includesAll() {
        return includeUsers.contains(ALL);
    }

    public int exclusionCount() {
        return excludeUsers.size() + excludeGroups.size() + excludeRoles.size();
    }

    /**
     * Whether a user with the given group and role memberships falls inside this scope.
     */
    public boolean matches(String userId, Set<String> groupIds, Set<String> roleIds) {
        boolean excluded = excludeUsers.contains(userId)
            || groupIds.stream().anyMatch(excludeGroups::contains)
            || roleIds.stream().anyMatch(excludeRoles::contains);
        if (excluded) {
            return false;
        }
        return includesAll()
            || includeUsers.contains(userId)
            || groupIds.stream().anyMatch(includeGroups::contains)
            || roleIds.stream().anyMatch(includeRoles::contains);
    }
}
