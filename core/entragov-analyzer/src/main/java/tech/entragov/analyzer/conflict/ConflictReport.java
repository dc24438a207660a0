package tech.entragov.analyzer.conflict;

import tech.entragov.analyzer.model.Violation;

import java.util.List;

public record ConflictReport(
    int policiesCompared,
    List<PolicyConflict> conflicts,
    List<Violation> violations
) {}
