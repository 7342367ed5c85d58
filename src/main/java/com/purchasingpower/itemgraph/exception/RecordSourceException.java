package com.purchasingpower.itemgraph.exception;

import lombok.Getter;

/**
 * An export file is missing or is not a readable export document.
 */
@Getter
public class RecordSourceException extends RuntimeException {

    private final String location;

    public RecordSourceException(String location, String message) {
        super(message);
        this.location = location;
    }

    public RecordSourceException(String location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }
}
