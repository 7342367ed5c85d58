package com.purchasingpower.itemgraph.exception;

import lombok.Getter;

@Getter
public class IngestionInProgressException extends RuntimeException {

    private final String activeRunId;

    public IngestionInProgressException(String activeRunId) {
        super("Ingestion run " + activeRunId + " is still in progress");
        this.activeRunId = activeRunId;
    }
}
