package com.gigateer.ingestor.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * States a run moves through. Stages only move forward; any non-terminal
 * stage may jump straight to {@link #FAILED}.
 */
public enum PipelineStage {
    PENDING,
    FETCHING,
    EXTRACTING,
    NORMALIZING,
    DEDUPLICATING,
    PERSISTING,
    COMPLETED,
    PARTIALLY_FAILED,
    FAILED;

    private static final Set<PipelineStage> TERMINAL = EnumSet.of(COMPLETED, PARTIALLY_FAILED, FAILED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canMoveTo(PipelineStage next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        if (next == COMPLETED || next == PARTIALLY_FAILED) {
            return this == PERSISTING;
        }
        return next.ordinal() == ordinal() + 1;
    }

    public RunStatus toStatus() {
        switch (this) {
            case COMPLETED:
                return RunStatus.COMPLETED;
            case PARTIALLY_FAILED:
                return RunStatus.PARTIAL;
            case FAILED:
                return RunStatus.FAILED;
            default:
                return RunStatus.RUNNING;
        }
    }
}
