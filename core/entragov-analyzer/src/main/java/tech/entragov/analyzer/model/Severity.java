package tech.entragov.analyzer.model;

/**
 * Violation severity, in ascending order.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
