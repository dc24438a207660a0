package tech.entragov.analyzer.coverage;

/**
 * Strength of a single enabled policy, 0-100.
 */
public record PolicyScore(
    String policyId,
    String displayName,
    int score
) {}
