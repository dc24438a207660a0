package tech.entragov.analyzer.conflict;

import tech.entragov.analyzer.model.Severity;
import tech.entragov.analyzer.model.ViolationKind;

/**
 * How two overlapping policies interfere.
 */
public enum ConflictType {
    /** One blocks what the other grants */
    CONTRADICTORY(ViolationKind.CONTRADICTORY_POLICIES, Severity.CRITICAL),

    /** Same targeting, one requirement set contains the other */
    REDUNDANT(ViolationKind.REDUNDANT_POLICIES, Severity.LOW),

    /** Same targeting, AND in one and OR in the other */
    OPERATOR_MISMATCH(ViolationKind.GRANT_OPERATOR_MISMATCH, Severity.MEDIUM);

    private final ViolationKind kind;
    private final Severity severity;

    ConflictType(ViolationKind kind, Severity severity) {
        this.kind = kind;
        this.severity = severity;
    }

    public ViolationKind kind() {
        return kind;
    }

    public Severity severity() {
        return severity;
    }
}
