package com.purchasingpower.itemgraph.report;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects diagnostics from every stage of one run.
 *
 * <p>One instance per run. Stages hand over their diagnostics after they finish,
 * so the final order follows stage order and, within a stage, input order.
 * Recording never throws and never stops the run.
 *
 * @since 1.0.0
 */
@Slf4j
public class IntegrityReporter {

    private final String runId;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public IntegrityReporter(String runId) {
        this.runId = runId;
    }

    public synchronized void record(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        if (diagnostic.getSeverity() == Severity.WARNING) {
            log.debug("[{}] {} {} {}: {}", runId, diagnostic.getStage(), diagnostic.getKind(),
                    diagnostic.getIdentifier(), diagnostic.getDetail());
        } else {
            log.warn("[{}] {} {} {}: {}", runId, diagnostic.getStage(), diagnostic.getKind(),
                    diagnostic.getIdentifier(), diagnostic.getDetail());
        }
    }

    public void recordAll(Collection<Diagnostic> batch) {
        for (Diagnostic diagnostic : batch) {
            record(diagnostic);
        }
    }

    public synchronized List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }

    public synchronized boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public synchronized boolean hasFatal() {
        return diagnostics.stream().anyMatch(Diagnostic::isFatal);
    }

    public synchronized long count(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.getKind() == kind).count();
    }

    /**
     * Diagnostic counts per kind, in declaration order, zero counts omitted.
     */
    public synchronized Map<String, Integer> countsByKind() {
        Map<DiagnosticKind, Integer> counts = new EnumMap<>(DiagnosticKind.class);
        for (Diagnostic diagnostic : diagnostics) {
            counts.merge(diagnostic.getKind(), 1, Integer::sum);
        }
        Map<String, Integer> result = new LinkedHashMap<>();
        counts.forEach((kind, count) -> result.put(kind.name(), count));
        return result;
    }

    /**
     * Overall status for a run that got as far as it did.
     *
     * @param committed whether every store batch committed
     * @param cancelled whether the run was interrupted before touching the store
     */
    public RunStatus resolveStatus(boolean committed, boolean cancelled) {
        if (cancelled) {
            return RunStatus.CANCELLED;
        }
        if (!committed || hasFatal()) {
            return RunStatus.FAILED;
        }
        return isEmpty() ? RunStatus.SUCCEEDED : RunStatus.SUCCEEDED_WITH_WARNINGS;
    }

    public String getRunId() {
        return runId;
    }
}
