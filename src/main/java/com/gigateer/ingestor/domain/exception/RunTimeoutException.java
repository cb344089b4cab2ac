package com.gigateer.ingestor.domain.exception;

import com.gigateer.ingestor.domain.model.ErrorStage;
import com.gigateer.ingestor.domain.model.PipelineStage;

/**
 * The run exceeded its wall-clock budget. Fatal for the run.
 */
public class RunTimeoutException extends IngestionException {

    private final PipelineStage abortedAt;

    public RunTimeoutException(PipelineStage abortedAt, long budgetMs) {
        super(ErrorStage.of(abortedAt),
            String.format("Run exceeded %d ms budget during %s", budgetMs, abortedAt));
        this.abortedAt = abortedAt;
    }

    public PipelineStage getAbortedAt() {
        return abortedAt;
    }

    @Override
    public String getKind() {
        return "TIMEOUT";
    }
}
