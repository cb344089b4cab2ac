package com.gigateer.ingestor.domain.model;

/**
 * Pipeline stage an error log entry was raised in.
 */
public enum ErrorStage {
    FETCH("fetch"),
    EXTRACT("extract"),
    NORMALIZE("normalize"),
    PERSIST("persist");

    private final String key;

    ErrorStage(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static ErrorStage fromKey(String key) {
        for (ErrorStage stage : values()) {
            if (stage.key.equals(key)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown error stage: " + key);
    }

    /**
     * Error stage charged for a run-level failure that happened while the run was in {@code stage}.
     */
    public static ErrorStage of(PipelineStage stage) {
        switch (stage) {
            case EXTRACTING:
                return EXTRACT;
            case NORMALIZING:
            case DEDUPLICATING:
                return NORMALIZE;
            case PERSISTING:
                return PERSIST;
            default:
                return FETCH;
        }
    }

    @Override
    public String toString() {
        return key;
    }
}
