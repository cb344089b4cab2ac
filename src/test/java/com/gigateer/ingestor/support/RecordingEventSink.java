package com.gigateer.ingestor.support;

import com.gigateer.ingestor.domain.model.ClassifiedGig;
import com.gigateer.ingestor.domain.model.ErrorLogEntry;
import com.gigateer.ingestor.domain.model.PipelineStage;
import com.gigateer.ingestor.domain.model.ScraperRun;
import com.gigateer.ingestor.domain.ports.IngestionEventSink;

import java.util.ArrayList;
import java.util.List;

/**
 * Sink that keeps every event for later assertions.
 */
public class RecordingEventSink implements IngestionEventSink {

    public final List<PipelineStage> stages = new ArrayList<>();
    public final List<ErrorLogEntry> errors = new ArrayList<>();
    public final List<ClassifiedGig> collisions = new ArrayList<>();
    public final List<ScraperRun> closed = new ArrayList<>();

    @Override
    public synchronized void stageChanged(ScraperRun run, PipelineStage from, PipelineStage to) {
        stages.add(to);
    }

    @Override
    public synchronized void errorRecorded(ErrorLogEntry entry) {
        errors.add(entry);
    }

    @Override
    public synchronized void crossSourceCollision(ScraperRun run, ClassifiedGig classified) {
        collisions.add(classified);
    }

    @Override
    public synchronized void runClosed(ScraperRun run) {
        closed.add(run);
    }
}
