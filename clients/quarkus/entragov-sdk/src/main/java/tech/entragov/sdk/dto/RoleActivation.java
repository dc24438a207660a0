package tech.entragov.sdk.dto;

import java.time.Instant;

/**
 * A PIM role activation request ({@code selfActivate} schedule request).
 */
public record RoleActivation(
    String id,
    String principalId,
    String roleId,
    String action,
    Instant createdAt
) {}
