package tech.entragov.analyzer.report;

/**
 * Headline scores. A score is null when the section it comes from is degraded.
 *
 * @param postureScore weighted mean of the coverage score and PIM compliance
 */
public record ScoreCard(
    Integer coverageScore,
    Integer pimComplianceScore,
    Double reviewCompletionRate,
    Integer postureScore
) {}
