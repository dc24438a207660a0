package tech.entragov.analyzer.report;

import tech.entragov.analyzer.model.ReportSection;
import tech.entragov.analyzer.model.TenantInventory;
import tech.entragov.sdk.dto.AccessPackage;
import tech.entragov.sdk.dto.AccessPackageAssignment;
import tech.entragov.sdk.dto.Policy;
import tech.entragov.sdk.dto.ReviewInstance;
import tech.entragov.sdk.dto.RoleActivation;
import tech.entragov.sdk.dto.RoleAssignment;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything fetched for one analysis run. {@code capturedAt} is the "now" every
 * analyzer evaluates against, so assembling the same snapshot twice gives equal reports.
 *
 * <p>A data set whose fetch failed is null and the sections depending on it carry the
 * failure in {@code fetchFailures}.
 */
public record AnalysisSnapshot(
    Instant capturedAt,
    List<Policy> policies,
    TenantInventory inventory,
    List<RoleAssignment> roleAssignments,
    List<RoleActivation> activations,
    List<ReviewInstance> reviewInstances,
    List<AccessPackage> accessPackages,
    List<AccessPackageAssignment> packageAssignments,
    Map<ReportSection, String> fetchFailures
) {
    public AnalysisSnapshot {
        fetchFailures = fetchFailures.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(fetchFailures));
    }
}
