package tech.entragov.analyzer.model;

/**
 * Sections of a governance report, one per analyzer.
 */
public enum ReportSection {
    COVERAGE,
    CONFLICTS,
    PIM,
    REVIEWS,
    ENTITLEMENTS
}
