package com.gigateer.ingestor.support;

import com.gigateer.ingestor.domain.model.ScraperRun;
import com.gigateer.ingestor.domain.ports.ScraperRunRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class InMemoryScraperRunRepository implements ScraperRunRepository {

    private final Map<String, ScraperRun> runs = new LinkedHashMap<>();

    @Override
    public synchronized void save(ScraperRun run) {
        runs.put(run.getRunId(), run);
    }

    @Override
    public synchronized ScraperRun findById(String runId) {
        return runs.get(runId);
    }

    @Override
    public synchronized List<ScraperRun> findRecentBySource(String sourceId, int limit) {
        return runs.values().stream()
            .filter(run -> run.getSourceId().equals(sourceId))
            .sorted(Comparator.comparing(ScraperRun::getStartedAt).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    public synchronized List<ScraperRun> all() {
        return new ArrayList<>(runs.values());
    }
}
