package tech.entragov.analyzer.coverage;

import tech.entragov.analyzer.model.Violation;
import tech.entragov.sdk.enums.PolicyState;

import java.util.List;
import java.util.Map;

/**
 * Conditional Access coverage and score.
 *
 * @param score            weighted overall score, 0-100
 * @param coverageScore    mean of user and application coverage percentages
 * @param mfaStrictness    how strictly grant policies demand MFA, 0-100
 * @param locationSession  use of location conditions and session controls, 0-100
 * @param exclusionMinimality 100 when policies carve out no exclusions
 * @param policyScores     per enabled policy, strongest first
 */
public record CoverageReport(
    int score,
    double coverageScore,
    double userCoveragePct,
    double appCoveragePct,
    double mfaStrictness,
    double locationSession,
    double exclusionMinimality,
    int coveredUsers,
    int totalUsers,
    int coveredApps,
    int totalApps,
    Map<PolicyState, Integer> policiesByState,
    List<PolicyScore> policyScores,
    List<Violation> violations,
    List<String> recommendations
) {}
