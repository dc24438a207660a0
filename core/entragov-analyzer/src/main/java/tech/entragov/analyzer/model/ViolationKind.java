package tech.entragov.analyzer.model;

/**
 * Every kind of finding the analyzers report.
 */
public enum ViolationKind {
    STANDING_ADMIN_ACCESS(ReportSection.PIM),
    EXCESSIVE_ROLE_ASSIGNMENTS(ReportSection.PIM),
    DORMANT_ELIGIBILITY(ReportSection.PIM),
    COVERAGE_GAP(ReportSection.COVERAGE),
    REPORT_ONLY_COVERAGE(ReportSection.COVERAGE),
    MISSING_SESSION_CONTROLS(ReportSection.COVERAGE),
    REDUNDANT_POLICIES(ReportSection.CONFLICTS),
    CONTRADICTORY_POLICIES(ReportSection.CONFLICTS),
    GRANT_OPERATOR_MISMATCH(ReportSection.CONFLICTS),
    OVERDUE_REVIEW(ReportSection.REVIEWS),
    LOW_REVIEWER_PARTICIPATION(ReportSection.REVIEWS),
    UNGOVERNED_ACCESS_PACKAGE(ReportSection.ENTITLEMENTS);

    private final ReportSection section;

    ViolationKind(ReportSection section) {
        this.section = section;
    }

    public ReportSection section() {
        return section;
    }
}
