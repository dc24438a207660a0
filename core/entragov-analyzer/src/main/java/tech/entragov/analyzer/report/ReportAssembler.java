package tech.entragov.analyzer.report;

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
import tech.entragov.analyzer.model.Severity;
import tech.entragov.analyzer.model.Violation;
import tech.entragov.analyzer.pim.PimAnalyzer;
import tech.entragov.analyzer.pim.PimReport;
import tech.entragov.analyzer.review.AccessReviewAnalyzer;
import tech.entragov.analyzer.review.ReviewReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs every analyzer over a snapshot and merges the results into one report.
 *
 * <p>Assembly is a pure function of the snapshot. A section whose data failed to fetch,
 * or whose analyzer throws, is marked degraded with the reason; the other sections are
 * still produced. The posture score needs both the coverage and the PIM section.
 */
@ApplicationScoped
public class ReportAssembler {

    private static final Logger LOG = Logger.getLogger(ReportAssembler.class);

    private final CoverageAnalyzer coverageAnalyzer;
    private final ConflictDetector conflictDetector;
    private final PimAnalyzer pimAnalyzer;
    private final AccessReviewAnalyzer reviewAnalyzer;
    private final EntitlementAnalyzer entitlementAnalyzer;
    private final AnalysisSettings settings;

    @Inject
    public ReportAssembler(CoverageAnalyzer coverageAnalyzer, ConflictDetector conflictDetector,
                           PimAnalyzer pimAnalyzer, AccessReviewAnalyzer reviewAnalyzer,
                           EntitlementAnalyzer entitlementAnalyzer, AnalysisSettings settings) {
        this.coverageAnalyzer = coverageAnalyzer;
        this.conflictDetector = conflictDetector;
        this.pimAnalyzer = pimAnalyzer;
        this.reviewAnalyzer = reviewAnalyzer;
        this.entitlementAnalyzer = entitlementAnalyzer;
        this.settings = settings;
    }

    /**
     * Analyzers with {@link AnalysisSettings#defaults()}, for use without CDI.
     */
    public static ReportAssembler withDefaults() {
        AnalysisSettings settings = AnalysisSettings.defaults();
        return new ReportAssembler(new CoverageAnalyzer(settings), new ConflictDetector(),
            new PimAnalyzer(settings), new AccessReviewAnalyzer(settings), new EntitlementAnalyzer(settings),
            settings);
    }

    public GovernanceReport assemble(AnalysisSnapshot snapshot) {
        Map<ReportSection, SectionStatus> sections = new EnumMap<>(ReportSection.class);
        List<Violation> violations = new ArrayList<>();

        CoverageReport coverage = run(ReportSection.COVERAGE, snapshot, sections,
            () -> coverageAnalyzer.analyze(
                require(snapshot.policies(), "policies"),
                require(snapshot.inventory(), "tenant inventory")));
        ConflictReport conflicts = run(ReportSection.CONFLICTS, snapshot, sections,
            () -> conflictDetector.detect(require(snapshot.policies(), "policies")));
        PimReport pim = run(ReportSection.PIM, snapshot, sections,
            () -> pimAnalyzer.analyze(
                require(snapshot.roleAssignments(), "role assignments"),
                require(snapshot.activations(), "role activations"),
                snapshot.capturedAt()));
        ReviewReport reviews = run(ReportSection.REVIEWS, snapshot, sections,
            () -> reviewAnalyzer.analyze(require(snapshot.reviewInstances(), "review instances"),
                snapshot.capturedAt()));
        EntitlementReport entitlements = run(ReportSection.ENTITLEMENTS, snapshot, sections,
            () -> entitlementAnalyzer.analyze(
                require(snapshot.accessPackages(), "access packages"),
                require(snapshot.packageAssignments(), "access package assignments"),
                snapshot.capturedAt()));

        collect(violations, coverage, CoverageReport::violations);
        collect(violations, conflicts, ConflictReport::violations);
        collect(violations, pim, PimReport::violations);
        collect(violations, reviews, ReviewReport::violations);
        collect(violations, entitlements, EntitlementReport::violations);
        violations.sort(Violation.REPORT_ORDER);

        ScoreCard scores = new ScoreCard(
            coverage != null ? coverage.score() : null,
            pim != null ? pim.complianceScore() : null,
            reviews != null ? reviews.overallCompletionRate() : null,
            postureScore(coverage, pim));

        return new GovernanceReport(
            snapshot.capturedAt(),
            scores,
            List.copyOf(violations),
            countBySeverity(violations),
            Collections.unmodifiableMap(sections),
            coverage,
            conflicts,
            pim,
            reviews,
            entitlements);
    }

    /**
     * Weighted mean of the coverage score and PIM compliance; null unless both exist.
     */
    Integer postureScore(CoverageReport coverage, PimReport pim) {
        if (coverage == null || pim == null) {
            return null;
        }
        double coverageWeight = settings.postureCoverageWeight();
        double pimWeight = settings.posturePimWeight();
        double total = coverageWeight + pimWeight;
        if (total <= 0) {
            return null;
        }
        double weighted = (coverageWeight * coverage.score() + pimWeight * pim.complianceScore()) / total;
        return (int) Math.round(weighted);
    }

    private <T> T run(ReportSection section, AnalysisSnapshot snapshot,
                      Map<ReportSection, SectionStatus> sections, Supplier<T> analysis) {
        String fetchFailure = snapshot.fetchFailures().get(section);
        if (fetchFailure != null) {
            LOG.warnf("Section %s degraded: %s", section, fetchFailure);
            sections.put(section, SectionStatus.degraded(fetchFailure));
            return null;
        }
        try {
            T result = analysis.get();
            sections.put(section, SectionStatus.ok());
            return result;
        } catch (RuntimeException e) {
            LOG.warnf(e, "Section %s degraded: analysis failed", section);
            sections.put(section, SectionStatus.degraded(
                "Analysis failed: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())));
            return null;
        }
    }

    private static <T> T require(T data, String name) {
        if (data == null) {
            throw new IllegalStateException("No " + name + " in snapshot");
        }
        return data;
    }

    private static <R> void collect(List<Violation> into, R report, Function<R, List<Violation>> violations) {
        if (report != null) {
            into.addAll(violations.apply(report));
        }
    }

    private static Map<Severity, Integer> countBySeverity(List<Violation> violations) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0);
        }
        violations.forEach(v -> counts.merge(v.severity(), 1, Integer::sum));
        return Collections.unmodifiableMap(counts);
    }
}
