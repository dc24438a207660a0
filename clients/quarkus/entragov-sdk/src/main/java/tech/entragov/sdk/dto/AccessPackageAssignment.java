package tech.entragov.sdk.dto;

import java.time.Instant;

/**
 * @param expiresAt scheduled end of the assignment, null when it never expires
 */
public record AccessPackageAssignment(
    String id,
    String accessPackageId,
    String targetId,
    String state,
    Instant expiresAt
) {}
