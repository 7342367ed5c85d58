package com.purchasingpower.itemgraph.report;

/**
 * Kinds of integrity findings, each with the severity it is reported at.
 *
 * @since 1.0.0
 */
public enum DiagnosticKind {
    MALFORMED_RECORD(Severity.ERROR),
    MALFORMED_INGREDIENT(Severity.WARNING),
    DUPLICATE_IDENTIFIER(Severity.WARNING),
    COERCION_FAILURE(Severity.WARNING),
    OUT_OF_RANGE(Severity.WARNING),
    DANGLING_REFERENCE(Severity.ERROR),
    MISSING_REFERENCE(Severity.ERROR),
    AMBIGUOUS_REFERENCE(Severity.WARNING),
    MISSING_CATEGORY(Severity.WARNING),
    STALE_NODE(Severity.WARNING),
    STORE_COMMIT_FAILURE(Severity.FATAL);

    private final Severity severity;

    DiagnosticKind(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }
}
