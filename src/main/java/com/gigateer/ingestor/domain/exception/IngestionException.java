package com.gigateer.ingestor.domain.exception;

import com.gigateer.ingestor.domain.model.ErrorStage;

/**
 * Base for failures raised inside an ingestion run.
 */
public abstract class IngestionException extends Exception {

    private final ErrorStage stage;

    protected IngestionException(ErrorStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    protected IngestionException(ErrorStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public ErrorStage getStage() {
        return stage;
    }

    /**
     * Classification written to the error log.
     */
    public abstract String getKind();
}
