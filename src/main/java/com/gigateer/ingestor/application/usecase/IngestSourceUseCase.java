package com.gigateer.ingestor.application.usecase;

import com.gigateer.ingestor.application.dedup.GigDeduplicator;
import com.gigateer.ingestor.application.normalize.GigNormalizer;
import com.gigateer.ingestor.application.persistence.PersistenceCoordinator;
import com.gigateer.ingestor.application.run.RunDeadline;
import com.gigateer.ingestor.application.run.RunTracker;
import com.gigateer.ingestor.application.run.SourceRunLocks;
import com.gigateer.ingestor.domain.exception.FetchException;
import com.gigateer.ingestor.domain.exception.IngestionException;
import com.gigateer.ingestor.domain.exception.NormalizationException;
import com.gigateer.ingestor.domain.exception.RunFailedException;
import com.gigateer.ingestor.domain.exception.RunTimeoutException;
import com.gigateer.ingestor.domain.exception.SourceBusyException;
import com.gigateer.ingestor.domain.exception.StoreUnavailableException;
import com.gigateer.ingestor.domain.exception.UnknownSourceException;
import com.gigateer.ingestor.domain.model.BulkOperationResult;
import com.gigateer.ingestor.domain.model.BulkOperationResult.FailedWrite;
import com.gigateer.ingestor.domain.model.ClassifiedGig;
import com.gigateer.ingestor.domain.model.ErrorStage;
import com.gigateer.ingestor.domain.model.Gig;
import com.gigateer.ingestor.domain.model.MergeAction;
import com.gigateer.ingestor.domain.model.NormalizedGig;
import com.gigateer.ingestor.domain.model.PipelineStage;
import com.gigateer.ingestor.domain.model.RawRecord;
import com.gigateer.ingestor.domain.model.RunCounts;
import com.gigateer.ingestor.domain.model.ScraperRun;
import com.gigateer.ingestor.domain.model.SourceConfig;
import com.gigateer.ingestor.domain.ports.GigRepository;
import com.gigateer.ingestor.domain.ports.IngestionEventSink;
import com.gigateer.ingestor.domain.ports.SourceAdapter;
import com.gigateer.ingestor.domain.ports.SourceConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Runs the full pipeline for one source: fetch, extract, normalize,
 * deduplicate, persist, then close the run.
 *
 * <p>Failures of single records are logged and counted; the run goes on.
 * A fetch failure, an empty listing, an exhausted time budget or an
 * unreachable store close the run as FAILED and surface a
 * {@link RunFailedException}.
 */
@Service
public class IngestSourceUseCase {

    private static final Logger logger = LoggerFactory.getLogger(IngestSourceUseCase.class);

    static final String KIND_EXTRACTION = "EXTRACTION";
    static final String KIND_STREAM_ABORTED = "STREAM_ABORTED";
    static final String KIND_WRITE_REJECTED = "WRITE_REJECTED";
    static final String KIND_STORE_UNAVAILABLE = "STORE_UNAVAILABLE";
    static final String KIND_INTERNAL = "INTERNAL";

    private final Map<String, SourceAdapter> adapters = new HashMap<>();
    private final SourceConfigProvider configProvider;
    private final GigNormalizer normalizer;
    private final GigDeduplicator deduplicator;
    private final PersistenceCoordinator persistenceCoordinator;
    private final GigRepository gigRepository;
    private final RunTracker runTracker;
    private final SourceRunLocks locks;
    private final IngestionEventSink eventSink;
    private final Clock clock;

    public IngestSourceUseCase(
            List<SourceAdapter> adapters,
            SourceConfigProvider configProvider,
            GigNormalizer normalizer,
            GigDeduplicator deduplicator,
            PersistenceCoordinator persistenceCoordinator,
            GigRepository gigRepository,
            RunTracker runTracker,
            SourceRunLocks locks,
            IngestionEventSink eventSink,
            Clock clock) {
        for (SourceAdapter adapter : adapters) {
            SourceAdapter previous = this.adapters.put(adapter.getSourceId(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for source " + adapter.getSourceId());
            }
        }
        this.configProvider = configProvider;
        this.normalizer = normalizer;
        this.deduplicator = deduplicator;
        this.persistenceCoordinator = persistenceCoordinator;
        this.gigRepository = gigRepository;
        this.runTracker = runTracker;
        this.locks = locks;
        this.eventSink = eventSink;
        this.clock = clock;
    }

    /**
     * Sources that have both an adapter and a configuration.
     */
    public Set<String> runnableSources() {
        Set<String> runnable = new LinkedHashSet<>();
        for (String sourceId : configProvider.sourceIds()) {
            if (adapters.containsKey(sourceId)) {
                runnable.add(sourceId);
            }
        }
        return runnable;
    }

    /**
     * Executes one run for the source.
     *
     * @return the closed run, COMPLETED or PARTIAL
     * @throws RunFailedException     if the run closed as FAILED
     * @throws UnknownSourceException if the source has no adapter or configuration
     * @throws SourceBusyException    if a run for the source is already in progress
     */
    public ScraperRun execute(String sourceId) throws RunFailedException {
        SourceAdapter adapter = adapters.get(sourceId);
        SourceConfig config = configProvider.find(sourceId).orElse(null);
        if (adapter == null || config == null) {
            throw new UnknownSourceException(sourceId);
        }
        if (!locks.tryAcquire(sourceId)) {
            logger.warn("Rejected run for source {}: previous run still in progress", sourceId);
            throw new SourceBusyException(sourceId);
        }

        MDC.put("sourceId", sourceId);
        try {
            return runLocked(adapter, config);
        } finally {
            MDC.remove("runId");
            MDC.remove("sourceId");
            locks.release(sourceId);
        }
    }

    private ScraperRun runLocked(SourceAdapter adapter, SourceConfig config) throws RunFailedException {
        ScraperRun run = runTracker.start(config.sourceId());
        MDC.put("runId", run.getRunId());
        RunDeadline deadline = new RunDeadline(clock, run.getStartedAt(), config.runTimeoutMs());

        try {
            List<RawRecord> records = fetchAndExtract(run, adapter, config, deadline);
            List<NormalizedGig> normalized = normalize(run, records, config, deadline);
            List<ClassifiedGig> classified = deduplicate(run, normalized, deadline);
            persist(run, classified, config, deadline);
            markMissing(run, classified, config);

            PipelineStage terminal = run.getCounts().getFailed() > 0
                ? PipelineStage.PARTIALLY_FAILED
                : PipelineStage.COMPLETED;
            runTracker.close(run, terminal, null);
            logger.info("Run {} for source {} finished as {}: {}",
                run.getRunId(), run.getSourceId(), run.getStatus(), run.getCounts());
            return run;
        } catch (IngestionException e) {
            throw fail(run, e.getStage(), e.getKind(), e.getMessage(), e);
        } catch (StoreUnavailableException e) {
            if (run.isClosed()) {
                throw e;
            }
            throw fail(run, ErrorStage.of(run.getStage()), KIND_STORE_UNAVAILABLE, e.getMessage(), e);
        } catch (RuntimeException e) {
            if (run.isClosed()) {
                throw e;
            }
            logger.error("Unexpected error in run {} for source {}", run.getRunId(), run.getSourceId(), e);
            throw fail(run, ErrorStage.of(run.getStage()), KIND_INTERNAL, e.toString(), e);
        }
    }

    private List<RawRecord> fetchAndExtract(
            ScraperRun run, SourceAdapter adapter, SourceConfig config, RunDeadline deadline)
            throws FetchException, RunTimeoutException {

        runTracker.advance(run, PipelineStage.FETCHING);
        deadline.check(PipelineStage.FETCHING);
        Stream<RawRecord> listings = adapter.fetchListings(config);

        runTracker.advance(run, PipelineStage.EXTRACTING);
        RunCounts counts = run.getCounts();
        List<RawRecord> records = new ArrayList<>();

        try (Stream<RawRecord> stream = listings) {
            Iterator<RawRecord> iterator = stream.iterator();
            while (true) {
                deadline.check(PipelineStage.EXTRACTING);
                RawRecord raw;
                try {
                    if (!iterator.hasNext()) {
                        break;
                    }
                    raw = iterator.next();
                } catch (RuntimeException e) {
                    if (counts.getScraped() == 0) {
                        throw new FetchException(config.sourceId(), "Listing failed before any record: " + e.getMessage(), e);
                    }
                    logger.warn("Listing stream for {} aborted after {} records", config.sourceId(), counts.getScraped(), e);
                    counts.addScraped(1);
                    runTracker.recordFailure(run, ErrorStage.EXTRACT, KIND_STREAM_ABORTED, e.toString(), null, null);
                    break;
                }

                counts.addScraped(1);
                if (raw.isExtractionFailure()) {
                    runTracker.recordFailure(run, ErrorStage.EXTRACT, KIND_EXTRACTION, raw.extractionError(), null, raw);
                } else {
                    records.add(raw);
                }
            }
        }

        if (counts.getScraped() == 0) {
            throw new FetchException(config.sourceId(), "Source returned no listings");
        }
        logger.info("Extracted {} records from {} ({} extraction failures)",
            counts.getScraped(), config.sourceId(), counts.getFailed());
        return records;
    }

    private List<NormalizedGig> normalize(
            ScraperRun run, List<RawRecord> records, SourceConfig config, RunDeadline deadline)
            throws RunTimeoutException {

        runTracker.advance(run, PipelineStage.NORMALIZING);
        List<NormalizedGig> normalized = new ArrayList<>(records.size());
        for (RawRecord raw : records) {
            deadline.check(PipelineStage.NORMALIZING);
            try {
                normalized.add(new NormalizedGig(normalizer.normalize(raw, config), raw));
            } catch (NormalizationException e) {
                logger.debug("Dropping record from {}: {}", config.sourceId(), e.getMessage());
                runTracker.recordFailure(run, ErrorStage.NORMALIZE, e.getKind(), e.getMessage(), null, raw);
            }
        }
        return normalized;
    }

    private List<ClassifiedGig> deduplicate(ScraperRun run, List<NormalizedGig> normalized, RunDeadline deadline)
            throws RunTimeoutException {

        runTracker.advance(run, PipelineStage.DEDUPLICATING);
        deadline.check(PipelineStage.DEDUPLICATING);

        Set<String> keys = new LinkedHashSet<>();
        Set<String> fingerprints = new LinkedHashSet<>();
        for (NormalizedGig gig : normalized) {
            keys.add(gig.gig().getIdentityKey());
            fingerprints.add(gig.gig().getFingerprint());
        }

        Map<String, Gig> existingByKey = keys.isEmpty() ? Map.of() : gigRepository.findByKeys(keys);
        Map<String, Gig> existingByFingerprint = fingerprints.isEmpty()
            ? Map.of()
            : gigRepository.findByFingerprints(fingerprints);

        List<ClassifiedGig> classified = deduplicator.classify(
            normalized, existingByKey, existingByFingerprint, clock.instant());

        for (ClassifiedGig gig : classified) {
            if (gig.action() == MergeAction.SKIP) {
                run.getCounts().addSkipped(1);
            }
            if (gig.isCrossSource()) {
                eventSink.crossSourceCollision(run, gig);
            }
        }
        return classified;
    }

    private void persist(ScraperRun run, List<ClassifiedGig> classified, SourceConfig config, RunDeadline deadline)
            throws RunTimeoutException {

        runTracker.advance(run, PipelineStage.PERSISTING);
        RunCounts counts = run.getCounts();
        persistenceCoordinator.persist(classified, config.batchSizeLimit(), deadline, chunk -> {
            counts.addCreated(chunk.created());
            counts.addUpdated(chunk.updated());
            counts.addUnchanged(chunk.unchanged());
            recordRejectedWrites(run, chunk);
        });
    }

    private void recordRejectedWrites(ScraperRun run, BulkOperationResult chunk) {
        for (FailedWrite failed : chunk.failed()) {
            runTracker.recordFailure(run, ErrorStage.PERSIST, KIND_WRITE_REJECTED, failed.error(), failed.key(), failed.raw());
        }
    }

    private void markMissing(ScraperRun run, List<ClassifiedGig> classified, SourceConfig config) {
        int failed = run.getCounts().getFailed();
        if (failed > 0) {
            // a record that failed to parse may still be listed, so absence proves nothing this run
            logger.info("Skipping staleness sweep for {}: {} records failed this run", run.getSourceId(), failed);
            return;
        }
        Set<String> seen = new LinkedHashSet<>();
        for (ClassifiedGig gig : classified) {
            seen.add(gig.key());
        }
        int flagged = gigRepository.markMissing(run.getSourceId(), seen, config.staleAfterRuns());
        if (flagged > 0) {
            logger.info("Flagged {} gigs of {} as stale", flagged, run.getSourceId());
        }
    }

    private RunFailedException fail(ScraperRun run, ErrorStage stage, String kind, String message, Exception cause) {
        logger.error("Run {} for source {} failed during {}: {}", run.getRunId(), run.getSourceId(), run.getStage(), message);
        try {
            runTracker.recordRunFailure(run, stage, kind, message);
        } catch (StoreUnavailableException e) {
            logger.error("Could not write error log for run {}", run.getRunId(), e);
        }
        try {
            runTracker.close(run, PipelineStage.FAILED, kind + ": " + message);
        } catch (StoreUnavailableException e) {
            logger.error("Could not save failed run {}", run.getRunId(), e);
        }
        return new RunFailedException(run, cause);
    }
}
