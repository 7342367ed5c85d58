package com.purchasingpower.itemgraph.pipeline;

import com.purchasingpower.itemgraph.exception.GraphStoreException;
import com.purchasingpower.itemgraph.report.IngestionReport;
import com.purchasingpower.itemgraph.report.RunStatus;
import com.purchasingpower.itemgraph.storage.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Runs one ingestion at startup when {@code itemgraph.run-on-startup} is set.
 *
 * <p>Exit codes: 0 succeeded (with or without warnings), 1 failed, 2 store unreachable,
 * 130 cancelled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "itemgraph.run-on-startup", havingValue = "true")
public class IngestionRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_FAILED = 1;
    static final int EXIT_UNREACHABLE = 2;
    static final int EXIT_CANCELLED = 130;

    private final IngestionPipeline pipeline;
    private final GraphStore graphStore;

    private int exitCode = 0;

    @Override
    public void run(String... args) {
        try {
            graphStore.verifyConnectivity();
        } catch (GraphStoreException e) {
            log.error("❌ {}", e.getMessage());
            exitCode = EXIT_UNREACHABLE;
            return;
        }

        IngestionReport report = pipeline.run();
        printSummary(report);
        exitCode = exitCodeFor(report.getStatus());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static int exitCodeFor(RunStatus status) {
        if (status == RunStatus.CANCELLED) {
            return EXIT_CANCELLED;
        }
        return status.isSuccess() ? 0 : EXIT_FAILED;
    }

    private void printSummary(IngestionReport report) {
        log.info("============================================================");
        log.info("Ingestion run {}: {}", report.getRunId(), report.getStatus());
        log.info("Nodes in graph:");
        for (Map.Entry<String, Long> entry : report.getStoreNodeTotals().entrySet()) {
            log.info("  {}: {}", entry.getKey(), entry.getValue());
        }
        log.info("Relationships in graph:");
        for (Map.Entry<String, Long> entry : report.getStoreEdgeTotals().entrySet()) {
            log.info("  {}: {}", entry.getKey(), entry.getValue());
        }
        if (!report.getDiagnosticCounts().isEmpty()) {
            log.info("Diagnostics: {}", report.getDiagnosticCounts());
        }
        if (report.getFailedStage() != null) {
            log.info("Failed at {} ({}): {}", report.getFailedStage(), report.getFailedBatch(), report.getFailureMessage());
        }
        log.info("============================================================");
    }
}
