package tech.entragov.analyzer.model;

import java.util.Comparator;

/**
 * A governance finding.
 *
 * @param subjectRef what the finding is about, e.g. {@code policy:1234} or {@code principal:abcd}
 * @param evidence   the observed facts behind the finding
 */
public record Violation(
    ViolationKind kind,
    Severity severity,
    String subjectRef,
    String evidence,
    String recommendation
) {
    /**
     * Report order: most severe first, then by kind, then by subject.
     */
    public static final Comparator<Violation> REPORT_ORDER = Comparator
        .comparing(Violation::severity, Comparator.reverseOrder())
        .thenComparing(Violation::kind)
        .thenComparing(Violation::subjectRef, Comparator.nullsLast(Comparator.naturalOrder()));
}
