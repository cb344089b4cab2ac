package com.gigateer.ingestor.domain.exception;

/**
 * Another run of the same source is still in progress.
 */
public class SourceBusyException extends RuntimeException {

    private final String sourceId;

    public SourceBusyException(String sourceId) {
        super("A run is already in progress for source " + sourceId);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
