package com.purchasingpower.itemgraph.report;

/**
 * Diagnostic severity.
 *
 * <p>WARNING and ERROR never stop a run. FATAL is reserved for store commit failures.
 */
public enum Severity {
    WARNING,
    ERROR,
    FATAL
}
