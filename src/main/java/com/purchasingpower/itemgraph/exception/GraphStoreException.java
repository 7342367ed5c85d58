package com.purchasingpower.itemgraph.exception;

import lombok.Getter;

/**
 * The graph store rejected or could not complete a write batch. The batch's
 * transaction was rolled back.
 */
@Getter
public class GraphStoreException extends RuntimeException {

    private final String batchId;

    public GraphStoreException(String batchId, String message) {
        super(message);
        this.batchId = batchId;
    }

    public GraphStoreException(String batchId, String message, Throwable cause) {
        super(message, cause);
        this.batchId = batchId;
    }
}
