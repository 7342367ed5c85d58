package com.purchasingpower.itemgraph.exception;

import com.purchasingpower.itemgraph.report.IngestionStage;
import lombok.Getter;

/**
 * A store batch could not be committed. Batches committed before it stay in the
 * store; the batch itself and every later one were not applied.
 */
@Getter
public class UpsertFailedException extends RuntimeException {

    private final IngestionStage stage;
    private final String batchId;

    public UpsertFailedException(IngestionStage stage, String batchId, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.batchId = batchId;
    }
}
