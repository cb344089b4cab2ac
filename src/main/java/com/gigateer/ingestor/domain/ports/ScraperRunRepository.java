package com.gigateer.ingestor.domain.ports;

import com.gigateer.ingestor.domain.model.ScraperRun;

import java.util.List;

/**
 * Port for persisting scraper run records.
 */
public interface ScraperRunRepository {

    /**
     * Inserts or replaces the run by its id.
     */
    void save(ScraperRun run);

    ScraperRun findById(String runId);

    /**
     * Most recent runs of a source, newest first.
     */
    List<ScraperRun> findRecentBySource(String sourceId, int limit);
}
