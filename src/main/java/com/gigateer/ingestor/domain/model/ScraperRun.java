package com.gigateer.ingestor.domain.model;

import java.time.Instant;

/**
 * One execution of the pipeline for one source. Created when the run
 * starts and closed exactly once.
 */
public class ScraperRun {

    private String runId;

    private String sourceId;

    private Instant startedAt;

    /** Null while the run is open. */
    private Instant endedAt;

    private RunStatus status = RunStatus.RUNNING;

    private PipelineStage stage = PipelineStage.PENDING;

    private RunCounts counts = new RunCounts();

    /** Top-level error for failed runs. */
    private String error;

    private long durationMs;

    public ScraperRun() {
    }

    public ScraperRun(String runId, String sourceId, Instant startedAt) {
        this.runId = runId;
        this.sourceId = sourceId;
        this.startedAt = startedAt;
    }

    public boolean isClosed() {
        return status.isTerminal();
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public void setEndedAt(Instant endedAt) {
        this.endedAt = endedAt;
    }

    public RunStatus getStatus() {
        return status;
    }

    public void setStatus(RunStatus status) {
        this.status = status;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public void setStage(PipelineStage stage) {
        this.stage = stage;
    }

    public RunCounts getCounts() {
        return counts;
    }

    public void setCounts(RunCounts counts) {
        this.counts = counts;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }
}
