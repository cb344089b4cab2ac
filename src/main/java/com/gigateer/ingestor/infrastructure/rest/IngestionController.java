package com.gigateer.ingestor.infrastructure.rest;

import com.gigateer.ingestor.application.usecase.IngestAllSourcesUseCase;
import com.gigateer.ingestor.application.usecase.IngestSourceUseCase;
import com.gigateer.ingestor.domain.exception.RunFailedException;
import com.gigateer.ingestor.domain.exception.SourceBusyException;
import com.gigateer.ingestor.domain.exception.UnknownSourceException;
import com.gigateer.ingestor.domain.model.ErrorLogEntry;
import com.gigateer.ingestor.domain.model.ScraperRun;
import com.gigateer.ingestor.domain.ports.ErrorLogRepository;
import com.gigateer.ingestor.domain.ports.ScraperRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for triggering ingestion runs and inspecting their outcome.
 */
@RestController
@RequestMapping("/ingestion")
public class IngestionController {

    private static final Logger logger = LoggerFactory.getLogger(IngestionController.class);
    private static final int MAX_RUNS_LIMIT = 100;

    private final IngestSourceUseCase ingestSourceUseCase;
    private final IngestAllSourcesUseCase ingestAllSourcesUseCase;
    private final ScraperRunRepository runRepository;
    private final ErrorLogRepository errorLogRepository;

    public IngestionController(
            IngestSourceUseCase ingestSourceUseCase,
            IngestAllSourcesUseCase ingestAllSourcesUseCase,
            ScraperRunRepository runRepository,
            ErrorLogRepository errorLogRepository) {
        this.ingestSourceUseCase = ingestSourceUseCase;
        this.ingestAllSourcesUseCase = ingestAllSourcesUseCase;
        this.runRepository = runRepository;
        this.errorLogRepository = errorLogRepository;
    }

    /**
     * Runs one source and returns the closed run. A failed run is still a
     * 200; its status and error describe the failure.
     *
     * POST /ingestion/sources/{sourceId}/run
     */
    @PostMapping("/sources/{sourceId}/run")
    public ResponseEntity<ScraperRun> runSource(@PathVariable String sourceId) {
        logger.info("Received request to run source {}", sourceId);
        try {
            return ResponseEntity.ok(ingestSourceUseCase.execute(sourceId));
        } catch (RunFailedException e) {
            return ResponseEntity.ok(e.getRun());
        } catch (UnknownSourceException e) {
            logger.warn(e.getMessage());
            return ResponseEntity.notFound().build();
        } catch (SourceBusyException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    /**
     * POST /ingestion/run-all
     */
    @PostMapping("/run-all")
    public ResponseEntity<IngestAllSourcesUseCase.IngestAllSummary> runAll() {
        logger.info("Received request to run all sources");
        IngestAllSourcesUseCase.IngestAllSummary summary = ingestAllSourcesUseCase.execute();
        logger.info("Run-all completed: {} runs, {} errors", summary.runs().size(), summary.errors().size());
        return ResponseEntity.ok(summary);
    }

    /**
     * GET /ingestion/runs/{runId}
     */
    @GetMapping("/runs/{runId}")
    public ResponseEntity<ScraperRun> getRun(@PathVariable String runId) {
        ScraperRun run = runRepository.findById(runId);
        return run != null ? ResponseEntity.ok(run) : ResponseEntity.notFound().build();
    }

    /**
     * GET /ingestion/sources/{sourceId}/runs?limit=20
     */
    @GetMapping("/sources/{sourceId}/runs")
    public ResponseEntity<List<ScraperRun>> recentRuns(
            @PathVariable String sourceId,
            @RequestParam(defaultValue = "20") int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_RUNS_LIMIT));
        return ResponseEntity.ok(runRepository.findRecentBySource(sourceId, bounded));
    }

    /**
     * GET /ingestion/runs/{runId}/errors
     */
    @GetMapping("/runs/{runId}/errors")
    public ResponseEntity<List<ErrorLogEntry>> runErrors(@PathVariable String runId) {
        return ResponseEntity.ok(errorLogRepository.findByRunId(runId));
    }
}
