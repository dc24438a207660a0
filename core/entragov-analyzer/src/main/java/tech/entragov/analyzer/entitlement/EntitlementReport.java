package tech.entragov.analyzer.entitlement;

import tech.entragov.analyzer.model.Violation;

import java.util.List;

/**
 * Access package governance.
 *
 * @param expiring assignments ending inside the warning window, soonest first
 */
public record EntitlementReport(
    int totalPackages,
    int totalAssignments,
    List<ExpiringAssignment> expiring,
    List<Violation> violations
) {}
