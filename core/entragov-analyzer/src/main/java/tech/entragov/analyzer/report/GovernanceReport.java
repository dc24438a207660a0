package tech.entragov.analyzer.report;

import tech.entragov.analyzer.conflict.ConflictReport;
import tech.entragov.analyzer.coverage.CoverageReport;
import tech.entragov.analyzer.entitlement.EntitlementReport;
import tech.entragov.analyzer.model.ReportSection;
import tech.entragov.analyzer.model.Severity;
import tech.entragov.analyzer.model.Violation;
import tech.entragov.analyzer.pim.PimReport;
import tech.entragov.analyzer.review.ReviewReport;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The merged result of one analysis run. Section details are null for degraded sections.
 *
 * @param violations    every finding, most severe first
 * @param summaryCounts findings per severity, every severity present
 */
public record GovernanceReport(
    Instant generatedAt,
    ScoreCard scores,
    List<Violation> violations,
    Map<Severity, Integer> summaryCounts,
    Map<ReportSection, SectionStatus> sections,
    CoverageReport coverage,
    ConflictReport conflicts,
    PimReport pim,
    ReviewReport reviews,
    EntitlementReport entitlements
) {}
