package com.gigateer.ingestor.application.run;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gigateer.ingestor.domain.model.ErrorLogEntry;
import com.gigateer.ingestor.domain.model.ErrorStage;
import com.gigateer.ingestor.domain.model.PipelineStage;
import com.gigateer.ingestor.domain.model.RawRecord;
import com.gigateer.ingestor.domain.model.ScraperRun;
import com.gigateer.ingestor.domain.ports.ErrorLogRepository;
import com.gigateer.ingestor.domain.ports.IngestionEventSink;
import com.gigateer.ingestor.domain.ports.ScraperRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Owns the lifecycle of {@link ScraperRun} records and the error log.
 *
 * <p>Every stage change and every failure is persisted and forwarded to the
 * {@link IngestionEventSink}. A run can be closed only once.
 */
public class RunTracker {

    private static final Logger logger = LoggerFactory.getLogger(RunTracker.class);

    private final ScraperRunRepository runRepository;
    private final ErrorLogRepository errorLogRepository;
    private final IngestionEventSink eventSink;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RunTracker(
            ScraperRunRepository runRepository,
            ErrorLogRepository errorLogRepository,
            IngestionEventSink eventSink,
            ObjectMapper objectMapper,
            Clock clock) {
        this.runRepository = runRepository;
        this.errorLogRepository = errorLogRepository;
        this.eventSink = eventSink;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ScraperRun start(String sourceId) {
        ScraperRun run = new ScraperRun(UUID.randomUUID().toString(), sourceId, clock.instant());
        runRepository.save(run);
        logger.info("Started run {} for source {}", run.getRunId(), sourceId);
        eventSink.stageChanged(run, null, PipelineStage.PENDING);
        return run;
    }

    /**
     * Moves a non-terminal run to its next stage.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void advance(ScraperRun run, PipelineStage next) {
        PipelineStage current = run.getStage();
        if (!current.canMoveTo(next) || next.isTerminal()) {
            throw new IllegalStateException(
                String.format("Run %s cannot move from %s to %s", run.getRunId(), current, next));
        }
        run.setStage(next);
        runRepository.save(run);
        eventSink.stageChanged(run, current, next);
    }

    /**
     * Records a failure of a single record and counts it as failed.
     */
    public ErrorLogEntry recordFailure(
            ScraperRun run, ErrorStage stage, String kind, String message, String identityKey, RawRecord raw) {
        run.getCounts().addFailed(1);
        return append(run, stage, kind, message, identityKey, snapshot(raw));
    }

    /**
     * Records a failure that ended the whole run. Not counted per record.
     */
    public ErrorLogEntry recordRunFailure(ScraperRun run, ErrorStage stage, String kind, String message) {
        return append(run, stage, kind, message, null, Map.of());
    }

    /**
     * Closes the run with a terminal stage and stores the final counts.
     *
     * @throws IllegalStateException if the run was already closed
     */
    public ScraperRun close(ScraperRun run, PipelineStage terminal, String error) {
        if (run.isClosed()) {
            throw new IllegalStateException("Run " + run.getRunId() + " is already closed");
        }
        if (!terminal.isTerminal() || !run.getStage().canMoveTo(terminal)) {
            throw new IllegalStateException(
                String.format("Run %s cannot close from %s as %s", run.getRunId(), run.getStage(), terminal));
        }

        PipelineStage previous = run.getStage();
        Instant endedAt = clock.instant();
        run.setStage(terminal);
        run.setStatus(terminal.toStatus());
        run.setEndedAt(endedAt);
        run.setDurationMs(Duration.between(run.getStartedAt(), endedAt).toMillis());
        run.setError(error);

        if (terminal != PipelineStage.FAILED && !run.getCounts().isBalanced()) {
            logger.warn("Run {} closed with unbalanced counts: {}", run.getRunId(), run.getCounts());
        }

        runRepository.save(run);
        eventSink.stageChanged(run, previous, terminal);
        eventSink.runClosed(run);
        return run;
    }

    private ErrorLogEntry append(
            ScraperRun run, ErrorStage stage, String kind, String message, String identityKey, Map<String, Object> raw) {
        ErrorLogEntry entry = new ErrorLogEntry(
            run.getRunId(), run.getSourceId(), stage, kind, message, identityKey, raw, clock.instant());
        errorLogRepository.append(entry);
        eventSink.errorRecorded(entry);
        return entry;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> snapshot(RawRecord raw) {
        if (raw == null) {
            return Map.of();
        }
        return objectMapper.convertValue(raw, Map.class);
    }
}
