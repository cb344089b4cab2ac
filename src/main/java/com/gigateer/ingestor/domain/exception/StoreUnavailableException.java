package com.gigateer.ingestor.domain.exception;

/**
 * The document store could not serve a request at all, as opposed to
 * rejecting individual documents. Fatal for the run that hit it.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
