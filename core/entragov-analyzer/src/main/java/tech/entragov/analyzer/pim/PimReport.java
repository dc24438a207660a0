package tech.entragov.analyzer.pim;

import tech.entragov.analyzer.model.Violation;

import java.util.List;
import java.util.Map;

/**
 * Privileged access findings.
 *
 * @param complianceScore     100 less the weighted violations, 0-100
 * @param activationsByRole   activations in the lookback window per role, by name where known
 */
public record PimReport(
    int complianceScore,
    int eligibleAssignments,
    int activeAssignments,
    int activations,
    List<RoleUsage> privilegedRoleUsage,
    Map<String, Integer> activationsByRole,
    List<Violation> violations,
    List<String> recommendations
) {}
