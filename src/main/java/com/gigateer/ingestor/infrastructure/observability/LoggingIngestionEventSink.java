package com.gigateer.ingestor.infrastructure.observability;

import com.gigateer.ingestor.domain.model.ClassifiedGig;
import com.gigateer.ingestor.domain.model.ErrorLogEntry;
import com.gigateer.ingestor.domain.model.PipelineStage;
import com.gigateer.ingestor.domain.model.ScraperRun;
import com.gigateer.ingestor.domain.ports.IngestionEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Writes pipeline events as structured log lines. Each line carries the
 * run's {@code sourceId} and {@code runId} in the MDC; whatever the calling
 * thread had under those keys is put back afterwards.
 */
@Component
public class LoggingIngestionEventSink implements IngestionEventSink {

    private static final Logger logger = LoggerFactory.getLogger(LoggingIngestionEventSink.class);

    static final String MDC_SOURCE_ID = "sourceId";
    static final String MDC_RUN_ID = "runId";

    @Override
    public void stageChanged(ScraperRun run, PipelineStage from, PipelineStage to) {
        withRunContext(run.getSourceId(), run.getRunId(), () ->
            logger.info("event=stage_changed from={} to={} counts=[{}]", from, to, run.getCounts()));
    }

    @Override
    public void errorRecorded(ErrorLogEntry entry) {
        withRunContext(entry.sourceId(), entry.runId(), () ->
            logger.warn("event=error stage={} kind={} key={} message=\"{}\"",
                entry.stage(), entry.errorKind(), entry.identityKey(), entry.message()));
    }

    @Override
    public void crossSourceCollision(ScraperRun run, ClassifiedGig classified) {
        withRunContext(run.getSourceId(), run.getRunId(), () ->
            logger.warn("event=dedup_conflict key={} owner={} action={} title=\"{}\"",
                classified.key(), classified.crossSourceOf(), classified.action(), classified.gig().getTitle()));
    }

    @Override
    public void runClosed(ScraperRun run) {
        withRunContext(run.getSourceId(), run.getRunId(), () ->
            logger.info("event=run_closed status={} durationMs={} counts=[{}] error={}",
                run.getStatus(), run.getDurationMs(), run.getCounts(), run.getError()));
    }

    static void withRunContext(String sourceId, String runId, Runnable action) {
        String previousSource = MDC.get(MDC_SOURCE_ID);
        String previousRun = MDC.get(MDC_RUN_ID);
        MDC.put(MDC_SOURCE_ID, sourceId);
        MDC.put(MDC_RUN_ID, runId);
        try {
            action.run();
        } finally {
            restore(MDC_SOURCE_ID, previousSource);
            restore(MDC_RUN_ID, previousRun);
        }
    }

    private static void restore(String key, String previous) {
        if (previous != null) {
            MDC.put(key, previous);
        } else {
            MDC.remove(key);
        }
    }
}
