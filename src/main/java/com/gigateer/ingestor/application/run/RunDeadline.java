package com.gigateer.ingestor.application.run;

import com.gigateer.ingestor.domain.exception.RunTimeoutException;
import com.gigateer.ingestor.domain.model.PipelineStage;

import java.time.Clock;
import java.time.Instant;

/**
 * Wall-clock budget of one run, checked cooperatively between units of work.
 */
public class RunDeadline {

    private final Clock clock;
    private final Instant expiresAt;
    private final long budgetMs;

    public RunDeadline(Clock clock, Instant startedAt, long budgetMs) {
        this.clock = clock;
        this.budgetMs = budgetMs;
        this.expiresAt = startedAt.plusMillis(budgetMs);
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * @throws RunTimeoutException if the budget is spent
     */
    public void check(PipelineStage stage) throws RunTimeoutException {
        if (isExpired()) {
            throw new RunTimeoutException(stage, budgetMs);
        }
    }
}
