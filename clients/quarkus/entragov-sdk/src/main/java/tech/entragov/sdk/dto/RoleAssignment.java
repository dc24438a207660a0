package tech.entragov.sdk.dto;

import tech.entragov.sdk.enums.AssignmentType;

import java.time.Instant;

/**
 * An eligible or active PIM role assignment.
 *
 * @param roleName resolved display name of the role, null when the definition is unknown
 * @param end      null for a permanent assignment
 */
public record RoleAssignment(
    String id,
    String principalId,
    String roleId,
    String roleName,
    AssignmentType assignmentType,
    Instant start,
    Instant end
) {
    public RoleAssignment withRoleName(String name) {
        return new RoleAssignment(id, principalId, roleId, name, assignmentType, start, end);
    }

    /**
     * Whether the assignment is in effect at {@code now}.
     */
    public boolean isInEffectAt(Instant now) {
        return (start == null || !start.isAfter(now)) && (end == null || end.isAfter(now));
    }
}
