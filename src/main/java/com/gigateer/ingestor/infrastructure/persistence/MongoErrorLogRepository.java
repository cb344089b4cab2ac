package com.gigateer.ingestor.infrastructure.persistence;

import com.gigateer.ingestor.domain.exception.StoreUnavailableException;
import com.gigateer.ingestor.domain.model.ErrorLogEntry;
import com.gigateer.ingestor.domain.ports.ErrorLogRepository;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Sorts;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * MongoDB implementation of ErrorLogRepository. Insert only.
 */
@Repository
public class MongoErrorLogRepository implements ErrorLogRepository {

    private static final Logger logger = LoggerFactory.getLogger(MongoErrorLogRepository.class);

    private final MongoCollection<Document> collection;

    public MongoErrorLogRepository(
            MongoClient mongoClient,
            @Value("${mongodb.database:gigateer}") String databaseName,
            @Value("${mongodb.collections.errors:error_logs}") String collectionName) {
        this.collection = mongoClient.getDatabase(databaseName).getCollection(collectionName);
        initializeIndexes();
    }

    private void initializeIndexes() {
        try {
            collection.createIndex(Indexes.ascending(DocumentMapper.RUN_ID));
            collection.createIndex(Indexes.compoundIndex(
                Indexes.ascending(DocumentMapper.SOURCE_ID),
                Indexes.descending(DocumentMapper.TIMESTAMP)));
        } catch (MongoException e) {
            logger.warn("Failed to create error log indexes (may already exist): {}", e.getMessage());
        }
    }

    @Override
    public void append(ErrorLogEntry entry) {
        try {
            collection.insertOne(DocumentMapper.toDocument(entry));
        } catch (MongoException e) {
            throw new StoreUnavailableException("Appending error log entry for run " + entry.runId() + " failed", e);
        }
    }

    @Override
    public List<ErrorLogEntry> findByRunId(String runId) {
        List<ErrorLogEntry> entries = new ArrayList<>();
        try {
            for (Document doc : collection.find(Filters.eq(DocumentMapper.RUN_ID, runId))
                    .sort(Sorts.ascending(DocumentMapper.TIMESTAMP))) {
                entries.add(DocumentMapper.toErrorLogEntry(doc));
            }
            return entries;
        } catch (MongoException e) {
            throw new StoreUnavailableException("Lookup of errors for run " + runId + " failed", e);
        }
    }
}
