package com.gigateer.ingestor.domain.exception;

import com.gigateer.ingestor.domain.model.ScraperRun;

/**
 * Summary error handed to the caller when a run closes as failed.
 * The closed run, with its counts, travels with it.
 */
public class RunFailedException extends Exception {

    private final transient ScraperRun run;

    public RunFailedException(ScraperRun run, Throwable cause) {
        super(String.format("Run %s for source %s failed: %s", run.getRunId(), run.getSourceId(), run.getError()), cause);
        this.run = run;
    }

    public ScraperRun getRun() {
        return run;
    }
}
