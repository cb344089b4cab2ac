package com.gigateer.ingestor.domain.exception;

public class UnknownSourceException extends RuntimeException {

    public UnknownSourceException(String sourceId) {
        super("No adapter or configuration registered for source " + sourceId);
    }
}
