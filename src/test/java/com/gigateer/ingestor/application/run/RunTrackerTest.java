package com.gigateer.ingestor.application.run;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gigateer.ingestor.domain.model.ErrorLogEntry;
import com.gigateer.ingestor.domain.model.ErrorStage;
import com.gigateer.ingestor.domain.model.PipelineStage;
import com.gigateer.ingestor.domain.model.RawRecord;
import com.gigateer.ingestor.domain.model.RunStatus;
import com.gigateer.ingestor.domain.model.ScraperRun;
import com.gigateer.ingestor.support.InMemoryErrorLogRepository;
import com.gigateer.ingestor.support.InMemoryScraperRunRepository;
import com.gigateer.ingestor.support.MutableClock;
import com.gigateer.ingestor.support.RecordingEventSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RunTracker.
 */
class RunTrackerTest {

    private InMemoryScraperRunRepository runs;
    private InMemoryErrorLogRepository errors;
    private RecordingEventSink sink;
    private MutableClock clock;
    private RunTracker tracker;

    @BeforeEach
    void setUp() {
        runs = new InMemoryScraperRunRepository();
        errors = new InMemoryErrorLogRepository();
        sink = new RecordingEventSink();
        clock = new MutableClock(Instant.parse("2025-05-01T10:00:00Z"));
        tracker = new RunTracker(runs, errors, sink, new ObjectMapper(), clock);
    }

    @Test
    void testStartPersistsRunningRun() {
        ScraperRun run = tracker.start("croft");

        assertNotNull(run.getRunId());
        assertEquals(RunStatus.RUNNING, run.getStatus());
        assertEquals(PipelineStage.PENDING, run.getStage());
        assertSame(run, runs.findById(run.getRunId()));
        assertEquals(List.of(PipelineStage.PENDING), sink.stages);
    }

    @Test
    void testStagesOnlyMoveForward() {
        ScraperRun run = tracker.start("croft");
        tracker.advance(run, PipelineStage.FETCHING);

        assertThrows(IllegalStateException.class, () -> tracker.advance(run, PipelineStage.NORMALIZING));
        assertThrows(IllegalStateException.class, () -> tracker.advance(run, PipelineStage.PENDING));
        assertThrows(IllegalStateException.class, () -> tracker.close(run, PipelineStage.COMPLETED, null));
        assertEquals(PipelineStage.FETCHING, run.getStage());
    }

    @Test
    void testRecordFailureCountsAndSnapshotsRaw() {
        ScraperRun run = tracker.start("croft");
        RawRecord raw = RawRecord.of("croft", Map.of("title", "Band A", "start", "someday"));

        ErrorLogEntry entry = tracker.recordFailure(run, ErrorStage.NORMALIZE, "INVALID_DATE", "bad date", null, raw);

        assertEquals(1, run.getCounts().getFailed());
        assertEquals(List.of(entry), errors.findByRunId(run.getRunId()));
        assertEquals(List.of(entry), sink.errors);
        assertEquals("croft", entry.rawPayload().get("sourceId"));
        assertEquals("someday", ((Map<?, ?>) entry.rawPayload().get("fields")).get("start"));
    }

    @Test
    void testRunFailureIsNotCountedPerRecord() {
        ScraperRun run = tracker.start("croft");

        tracker.recordRunFailure(run, ErrorStage.FETCH, "FETCH", "connection refused");

        assertEquals(0, run.getCounts().getFailed());
        assertEquals(1, errors.all().size());
        assertTrue(errors.all().get(0).rawPayload().isEmpty());
    }

    @Test
    void testCloseOnlyOnce() {
        ScraperRun run = tracker.start("croft");
        clock.advance(Duration.ofSeconds(3));

        tracker.close(run, PipelineStage.FAILED, "FETCH: connection refused");

        assertEquals(RunStatus.FAILED, run.getStatus());
        assertEquals(3_000L, run.getDurationMs());
        assertEquals(clock.instant(), run.getEndedAt());
        assertEquals(List.of(run), sink.closed);
        assertThrows(IllegalStateException.class, () -> tracker.close(run, PipelineStage.FAILED, "again"));
        assertEquals(1, sink.closed.size());
    }
}
