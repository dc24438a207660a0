package tech.entragov.analyzer.conflict;

/**
 * A conflicting pair of policies; {@code firstPolicyId} sorts before {@code secondPolicyId}.
 */
public record PolicyConflict(
    ConflictType type,
    String firstPolicyId,
    String firstPolicyName,
    String secondPolicyId,
    String secondPolicyName
) {}
