package com.gigateer.ingestor.application.usecase;

import com.gigateer.ingestor.domain.exception.RunFailedException;
import com.gigateer.ingestor.domain.exception.SourceBusyException;
import com.gigateer.ingestor.domain.model.RunStatus;
import com.gigateer.ingestor.domain.model.ScraperRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Use case for running every configured source in parallel.
 * Each source runs in isolation; one failing source does not affect the others.
 */
@Service
public class IngestAllSourcesUseCase {

    private static final Logger logger = LoggerFactory.getLogger(IngestAllSourcesUseCase.class);

    private final IngestSourceUseCase ingestSource;
    private final ExecutorService executorService;

    public IngestAllSourcesUseCase(
            IngestSourceUseCase ingestSource,
            @Value("${ingestor.parallelism:4}") int parallelism) {
        this.ingestSource = ingestSource;
        this.executorService = Executors.newFixedThreadPool(Math.max(parallelism, 1));
    }

    /**
     * Runs all sources and waits for every run to close.
     *
     * @return Summary with one entry per source
     */
    public IngestAllSummary execute() {
        List<String> sourceIds = List.copyOf(ingestSource.runnableSources());
        logger.info("Starting ingestion of {} sources", sourceIds.size());

        List<CompletableFuture<SourceOutcome>> futures = sourceIds.stream()
            .map(sourceId -> CompletableFuture.supplyAsync(() -> runSource(sourceId), executorService))
            .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Map<String, ScraperRun> runs = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        for (CompletableFuture<SourceOutcome> future : futures) {
            SourceOutcome outcome = future.join();
            if (outcome.run() != null) {
                runs.put(outcome.sourceId(), outcome.run());
            }
            if (outcome.error() != null) {
                errors.put(outcome.sourceId(), outcome.error());
            }
        }

        long failed = runs.values().stream().filter(run -> run.getStatus() == RunStatus.FAILED).count();
        logger.info("Ingestion finished: {} runs, {} failed, {} not started", runs.size(), failed,
            sourceIds.size() - runs.size());
        return new IngestAllSummary(runs, errors);
    }

    private SourceOutcome runSource(String sourceId) {
        try {
            return new SourceOutcome(sourceId, ingestSource.execute(sourceId), null);
        } catch (RunFailedException e) {
            return new SourceOutcome(sourceId, e.getRun(), e.getMessage());
        } catch (SourceBusyException e) {
            logger.warn("Skipping {}: {}", sourceId, e.getMessage());
            return new SourceOutcome(sourceId, null, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Source {} failed", sourceId, e);
            return new SourceOutcome(sourceId, null, e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
    }

    private record SourceOutcome(String sourceId, ScraperRun run, String error) {}

    /**
     * @param runs   closed run per source that started one
     * @param errors failure message per source that failed or did not start
     */
    public record IngestAllSummary(
        Map<String, ScraperRun> runs,
        Map<String, String> errors
    ) {}
}
