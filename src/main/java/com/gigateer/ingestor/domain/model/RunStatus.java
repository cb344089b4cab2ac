package com.gigateer.ingestor.domain.model;

/**
 * Status of a scraper run as stored and reported.
 */
public enum RunStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    PARTIAL("partial");

    private final String key;

    RunStatus(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public static RunStatus fromKey(String key) {
        for (RunStatus status : values()) {
            if (status.key.equals(key)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + key);
    }

    @Override
    public String toString() {
        return key;
    }
}
