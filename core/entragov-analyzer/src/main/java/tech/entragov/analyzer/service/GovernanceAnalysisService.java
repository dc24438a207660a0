package tech.entragov.analyzer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.entragov.analyzer.config.AnalysisSettings;
import tech.entragov.analyzer.conflict.ConflictDetector;
import tech.entragov.analyzer.conflict.ConflictReport;
import tech.entragov.analyzer.coverage.CoverageAnalyzer;
import tech.entragov.analyzer.coverage.CoverageReport;
import tech.entragov.analyzer.entitlement.EntitlementAnalyzer;
import tech.entragov.analyzer.entitlement.EntitlementReport;
import tech.entragov.analyzer.model.ReportSection;
import tech.entragov.analyzer.model.TenantInventory;
import tech.entragov.analyzer.pim.PimAnalyzer;
import tech.entragov.analyzer.pim.PimReport;
import tech.entragov.analyzer.report.AnalysisSnapshot;
import tech.entragov.analyzer.report.GovernanceReport;
import tech.entragov.analyzer.report.ReportAssembler;
import tech.entragov.analyzer.review.AccessReviewAnalyzer;
import tech.entragov.analyzer.review.ReviewReport;
import tech.entragov.sdk.client.GraphClient;
import tech.entragov.sdk.dto.AccessPackage;
import tech.entragov.sdk.dto.AccessPackageAssignment;
import tech.entragov.sdk.dto.Policy;
import tech.entragov.sdk.dto.ReviewInstance;
import tech.entragov.sdk.dto.RoleActivation;
import tech.entragov.sdk.dto.RoleAssignment;
import tech.entragov.sdk.enums.AssignmentType;
import tech.entragov.sdk.exception.GraphException;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Entry point for governance analysis: fetches tenant data through the Graph client and
 * runs the analyzers over it.
 *
 * <p>The single-analyzer operations let fetch errors propagate. {@link #captureSnapshot()}
 * and {@link #assembleReport()} record them per section instead, so one unreachable API
 * degrades only the sections that need it.
 */
@ApplicationScoped
public class GovernanceAnalysisService {

    private static final Logger LOG = Logger.getLogger(GovernanceAnalysisService.class);

    private final GraphClient client;
    private final CoverageAnalyzer coverageAnalyzer;
    private final ConflictDetector conflictDetector;
    private final PimAnalyzer pimAnalyzer;
    private final AccessReviewAnalyzer reviewAnalyzer;
    private final EntitlementAnalyzer entitlementAnalyzer;
    private final ReportAssembler reportAssembler;
    private final AnalysisSettings settings;
    private final Clock clock;

    @Inject
    public GovernanceAnalysisService(GraphClient client, CoverageAnalyzer coverageAnalyzer,
                                     ConflictDetector conflictDetector, PimAnalyzer pimAnalyzer,
                                     AccessReviewAnalyzer reviewAnalyzer, EntitlementAnalyzer entitlementAnalyzer,
                                     ReportAssembler reportAssembler, AnalysisSettings settings) {
        this(client, coverageAnalyzer, conflictDetector, pimAnalyzer, reviewAnalyzer, entitlementAnalyzer,
            reportAssembler, settings, Clock.systemUTC());
    }

    public GovernanceAnalysisService(GraphClient client, CoverageAnalyzer coverageAnalyzer,
                                     ConflictDetector conflictDetector, PimAnalyzer pimAnalyzer,
                                     AccessReviewAnalyzer reviewAnalyzer, EntitlementAnalyzer entitlementAnalyzer,
                                     ReportAssembler reportAssembler, AnalysisSettings settings, Clock clock) {
        this.client = client;
        this.coverageAnalyzer = coverageAnalyzer;
        this.conflictDetector = conflictDetector;
        this.pimAnalyzer = pimAnalyzer;
        this.reviewAnalyzer = reviewAnalyzer;
        this.entitlementAnalyzer = entitlementAnalyzer;
        this.reportAssembler = reportAssembler;
        this.settings = settings;
        this.clock = clock;
    }

    public CoverageReport analyzeCoverage() {
        List<Policy> policies = client.policies().list();
        List<RoleAssignment> active = client.roleManagement().activeAssignments();
        return coverageAnalyzer.analyze(policies, fetchInventory(active, clock.instant()));
    }

    public ConflictReport detectConflicts() {
        return conflictDetector.detect(client.policies().list());
    }

    public PimReport detectPimViolations() {
        Instant now = clock.instant();
        List<RoleAssignment> assignments = client.roleManagement().assignments();
        List<RoleActivation> activations = client.roleManagement()
            .activations(now.minus(settings.dormancyLookback()));
        return pimAnalyzer.analyze(assignments, activations, now);
    }

    public ReviewReport analyzeReviews() {
        return reviewAnalyzer.analyze(client.accessReviews().instances(), clock.instant());
    }

    public EntitlementReport analyzeEntitlements() {
        return entitlementAnalyzer.analyze(
            client.entitlements().accessPackages(),
            client.entitlements().assignments(),
            clock.instant());
    }

    /**
     * Fetch everything the analyzers need. A failed fetch leaves its data set null and
     * is recorded against every section that depends on it.
     */
    public AnalysisSnapshot captureSnapshot() {
        Instant now = clock.instant();
        Map<ReportSection, String> failures = new EnumMap<>(ReportSection.class);

        List<Policy> policies = fetch("policies", failures,
            () -> client.policies().list(), ReportSection.COVERAGE, ReportSection.CONFLICTS);
        // Role memberships feed the inventory, so coverage depends on the assignments too
        List<RoleAssignment> assignments = fetch("role assignments", failures,
            () -> client.roleManagement().assignments(), ReportSection.PIM, ReportSection.COVERAGE);
        List<RoleActivation> activations = fetch("role activations", failures,
            () -> client.roleManagement().activations(now.minus(settings.dormancyLookback())), ReportSection.PIM);
        TenantInventory inventory = assignments == null ? null : fetch("tenant inventory", failures,
            () -> fetchInventory(assignments, now), ReportSection.COVERAGE);
        List<ReviewInstance> reviews = fetch("access reviews", failures,
            () -> client.accessReviews().instances(), ReportSection.REVIEWS);
        List<AccessPackage> packages = fetch("access packages", failures,
            () -> client.entitlements().accessPackages(), ReportSection.ENTITLEMENTS);
        List<AccessPackageAssignment> packageAssignments = fetch("access package assignments", failures,
            () -> client.entitlements().assignments(), ReportSection.ENTITLEMENTS);

        LOG.infof("Captured analysis snapshot at %s (%d fetch failures)", now, failures.size());
        return new AnalysisSnapshot(now, policies, inventory, assignments, activations, reviews,
            packages, packageAssignments, failures);
    }

    public GovernanceReport assembleReport() {
        GovernanceReport report = reportAssembler.assemble(captureSnapshot());
        LOG.infof("Governance report: %d violations, posture score %s",
            report.violations().size(), report.scores().postureScore());
        return report;
    }

    private TenantInventory fetchInventory(List<RoleAssignment> assignments, Instant now) {
        Map<String, Set<String>> rolesByUser = new HashMap<>();
        for (RoleAssignment assignment : assignments) {
            if (assignment.assignmentType() == AssignmentType.ACTIVE && assignment.principalId() != null
                && assignment.roleId() != null && assignment.isInEffectAt(now)) {
                rolesByUser.computeIfAbsent(assignment.principalId(), k -> new HashSet<>()).add(assignment.roleId());
            }
        }
        return new TenantInventory(
            client.directory().users(),
            client.directory().applicationIds(),
            rolesByUser);
    }

    private <T> T fetch(String name, Map<ReportSection, String> failures, Supplier<T> fetcher,
                        ReportSection... dependents) {
        try {
            return fetcher.get();
        } catch (GraphException e) {
            LOG.warnf(e, "Failed to fetch %s", name);
            String reason = "Failed to fetch " + name
                + (e.hasResponse() ? " (HTTP " + e.getStatusCode() + ")" : "") + ": " + e.getMessage();
            for (ReportSection section : dependents) {
                failures.putIfAbsent(section, reason);
            }
            return null;
        }
    }
}
