package com.gigateer.ingestor.domain.exception;

import com.gigateer.ingestor.domain.model.ErrorStage;

/**
 * The source could not be reached or returned nothing usable. Fatal for the run.
 */
public class FetchException extends IngestionException {

    private final String sourceId;

    public FetchException(String sourceId, String message) {
        super(ErrorStage.FETCH, message);
        this.sourceId = sourceId;
    }

    public FetchException(String sourceId, String message, Throwable cause) {
        super(ErrorStage.FETCH, message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }

    @Override
    public String getKind() {
        return "FETCH";
    }
}
