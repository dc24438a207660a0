package tech.entragov.analyzer.entitlement;

import java.time.Instant;

public record ExpiringAssignment(
    String assignmentId,
    String accessPackageId,
    String targetId,
    Instant expiresAt,
    long daysUntilExpiration
) {}
