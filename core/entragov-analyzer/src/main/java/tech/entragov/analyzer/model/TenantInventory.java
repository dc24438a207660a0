package tech.entragov.analyzer.model;

import tech.entragov.sdk.dto.DirectoryUser;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The population policy coverage is measured against.
 *
 * @param roleIdsByUser directory roles currently held per user id, used to evaluate
 *                      role-targeted policies
 */
public record TenantInventory(
    List<DirectoryUser> users,
    Set<String> applicationIds,
    Map<String, Set<String>> roleIdsByUser
) {
    public TenantInventory {
        users = List.copyOf(users);
        applicationIds = Set.copyOf(applicationIds);
        roleIdsByUser = Map.copyOf(roleIdsByUser);
    }

    public static TenantInventory of(List<DirectoryUser> users, Set<String> applicationIds) {
        return new TenantInventory(users, applicationIds, Map.of());
    }

    public Set<String> rolesOf(String userId) {
        return roleIdsByUser.getOrDefault(userId, Set.of());
    }
}
