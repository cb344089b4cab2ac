package com.gigateer.ingestor.infrastructure.persistence;

import com.gigateer.ingestor.domain.exception.StoreUnavailableException;
import com.gigateer.ingestor.domain.model.ScraperRun;
import com.gigateer.ingestor.domain.ports.ScraperRunRepository;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.Sorts;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * MongoDB implementation of ScraperRunRepository. Runs are replaced by id on
 * every save, so the stored document always reflects the latest stage.
 */
@Repository
public class MongoScraperRunRepository implements ScraperRunRepository {

    private static final Logger logger = LoggerFactory.getLogger(MongoScraperRunRepository.class);

    private final MongoCollection<Document> collection;

    public MongoScraperRunRepository(
            MongoClient mongoClient,
            @Value("${mongodb.database:gigateer}") String databaseName,
            @Value("${mongodb.collections.runs:scraper_runs}") String collectionName) {
        this.collection = mongoClient.getDatabase(databaseName).getCollection(collectionName);
        initializeIndexes();
    }

    private void initializeIndexes() {
        try {
            collection.createIndex(Indexes.ascending(DocumentMapper.RUN_ID), new IndexOptions().unique(true));
            collection.createIndex(Indexes.compoundIndex(
                Indexes.ascending(DocumentMapper.SOURCE_ID),
                Indexes.descending(DocumentMapper.STARTED_AT)));
        } catch (MongoException e) {
            logger.warn("Failed to create run indexes (may already exist): {}", e.getMessage());
        }
    }

    @Override
    public void save(ScraperRun run) {
        try {
            collection.replaceOne(
                Filters.eq(DocumentMapper.RUN_ID, run.getRunId()),
                DocumentMapper.toDocument(run),
                new ReplaceOptions().upsert(true));
        } catch (MongoException e) {
            throw new StoreUnavailableException("Saving run " + run.getRunId() + " failed", e);
        }
    }

    @Override
    public ScraperRun findById(String runId) {
        try {
            Document doc = collection.find(Filters.eq(DocumentMapper.RUN_ID, runId)).first();
            return doc != null ? DocumentMapper.toRun(doc) : null;
        } catch (MongoException e) {
            throw new StoreUnavailableException("Lookup of run " + runId + " failed", e);
        }
    }

    @Override
    public List<ScraperRun> findRecentBySource(String sourceId, int limit) {
        List<ScraperRun> runs = new ArrayList<>();
        try {
            for (Document doc : collection.find(Filters.eq(DocumentMapper.SOURCE_ID, sourceId))
                    .sort(Sorts.descending(DocumentMapper.STARTED_AT))
                    .limit(limit)) {
                runs.add(DocumentMapper.toRun(doc));
            }
            return runs;
        } catch (MongoException e) {
            throw new StoreUnavailableException("Lookup of runs for " + sourceId + " failed", e);
        }
    }
}
