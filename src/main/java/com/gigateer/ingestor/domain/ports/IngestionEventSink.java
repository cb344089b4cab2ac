package com.gigateer.ingestor.domain.ports;

import com.gigateer.ingestor.domain.model.ClassifiedGig;
import com.gigateer.ingestor.domain.model.ErrorLogEntry;
import com.gigateer.ingestor.domain.model.PipelineStage;
import com.gigateer.ingestor.domain.model.ScraperRun;

/**
 * Receives structured pipeline events for an external logging or metrics
 * collector. Implementations must not throw.
 */
public interface IngestionEventSink {

    void stageChanged(ScraperRun run, PipelineStage from, PipelineStage to);

    void errorRecorded(ErrorLogEntry entry);

    /**
     * A record matched a gig first created by a different source.
     */
    void crossSourceCollision(ScraperRun run, ClassifiedGig classified);

    void runClosed(ScraperRun run);
}
