package com.purchasingpower.itemgraph.api;

import com.purchasingpower.itemgraph.exception.GraphStoreException;
import com.purchasingpower.itemgraph.exception.IngestionInProgressException;
import com.purchasingpower.itemgraph.pipeline.IngestionPipeline;
import com.purchasingpower.itemgraph.pipeline.IngestionStatus;
import com.purchasingpower.itemgraph.report.IngestionReport;
import com.purchasingpower.itemgraph.storage.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for running ingestions and inspecting the graph.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionPipeline pipeline;
    private final GraphStore graphStore;

    /**
     * Run an ingestion against the configured export files and return its report.
     * A failed run still returns 200 with status FAILED in the report.
     *
     * POST /api/v1/ingestions
     */
    @PostMapping("/ingestions")
    public ResponseEntity<?> runIngestion() {
        try {
            IngestionReport report = pipeline.run();
            return ResponseEntity.ok(report);
        } catch (IngestionInProgressException e) {
            log.warn("Rejected ingestion request: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse(e.getMessage()));
        }
    }

    /**
     * GET /api/v1/ingestions/status
     */
    @GetMapping("/ingestions/status")
    public ResponseEntity<IngestionStatus> getStatus() {
        return ResponseEntity.ok(pipeline.getStatus());
    }

    /**
     * Report of the last finished run, 404 before the first one.
     *
     * GET /api/v1/ingestions/last
     */
    @GetMapping("/ingestions/last")
    public ResponseEntity<IngestionReport> getLastReport() {
        return pipeline.getLastReport()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/graph/summary
     */
    @GetMapping("/graph/summary")
    public ResponseEntity<?> getGraphSummary() {
        try {
            return ResponseEntity.ok(GraphSummaryResponse.of(
                graphStore.getServiceType().getName(),
                graphStore.countNodes(),
                graphStore.countEdges()));
        } catch (GraphStoreException e) {
            log.error("Failed to read graph summary", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse(e.getMessage()));
        }
    }
}
