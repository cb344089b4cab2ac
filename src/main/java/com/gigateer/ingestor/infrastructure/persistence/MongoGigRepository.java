package com.gigateer.ingestor.infrastructure.persistence;

import com.gigateer.ingestor.domain.exception.StoreUnavailableException;
import com.gigateer.ingestor.domain.model.Gig;
import com.gigateer.ingestor.domain.ports.GigRepository;
import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoException;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.BulkWriteOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOneModel;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.UpdateOneModel;
import com.mongodb.client.model.Updates;
import com.mongodb.client.model.WriteModel;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * MongoDB implementation of GigRepository.
 *
 * Storage layout:
 * - one document per identity key, enforced by a unique index
 * - fingerprint index for cross-source lookups
 * - sourceId + startInstant index for staleness sweeps and listing queries
 */
@Repository
public class MongoGigRepository implements GigRepository {

    private static final Logger logger = LoggerFactory.getLogger(MongoGigRepository.class);

    private final MongoCollection<Document> collection;

    public MongoGigRepository(
            MongoClient mongoClient,
            @Value("${mongodb.database:gigateer}") String databaseName,
            @Value("${mongodb.collections.gigs:gigs}") String collectionName) {
        this.collection = mongoClient.getDatabase(databaseName).getCollection(collectionName);
        initializeIndexes();
    }

    private void initializeIndexes() {
        try {
            collection.createIndex(Indexes.ascending(DocumentMapper.IDENTITY_KEY), new IndexOptions().unique(true));
            collection.createIndex(Indexes.ascending(DocumentMapper.FINGERPRINT));
            collection.createIndex(Indexes.compoundIndex(
                Indexes.ascending(DocumentMapper.SOURCE_ID),
                Indexes.ascending(DocumentMapper.START_INSTANT)));
            logger.info("MongoDB indexes initialized for collection: {}", collection.getNamespace().getCollectionName());
        } catch (MongoException e) {
            logger.warn("Failed to create indexes (may already exist): {}", e.getMessage());
        }
    }

    @Override
    public Map<String, Gig> findByKeys(Collection<String> keys) {
        Map<String, Gig> found = new HashMap<>();
        if (keys.isEmpty()) {
            return found;
        }
        try {
            for (Document doc : collection.find(Filters.in(DocumentMapper.IDENTITY_KEY, keys))) {
                Gig gig = DocumentMapper.toGig(doc);
                found.put(gig.getIdentityKey(), gig);
            }
            return found;
        } catch (MongoException e) {
            throw new StoreUnavailableException("Lookup by identity key failed", e);
        }
    }

    @Override
    public Map<String, Gig> findByFingerprints(Collection<String> fingerprints) {
        Map<String, Gig> found = new HashMap<>();
        if (fingerprints.isEmpty()) {
            return found;
        }
        try {
            // Oldest first, so the gig that first listed the event owns the fingerprint.
            for (Document doc : collection.find(Filters.in(DocumentMapper.FINGERPRINT, fingerprints))
                    .sort(Sorts.ascending(DocumentMapper.FIRST_SEEN))) {
                Gig gig = DocumentMapper.toGig(doc);
                found.putIfAbsent(gig.getFingerprint(), gig);
            }
            return found;
        } catch (MongoException e) {
            throw new StoreUnavailableException("Lookup by fingerprint failed", e);
        }
    }

    @Override
    public List<WriteOutcome> bulkUpsert(List<GigWrite> operations) {
        if (operations.isEmpty()) {
            return List.of();
        }

        List<WriteModel<Document>> models = new ArrayList<>(operations.size());
        for (GigWrite operation : operations) {
            models.add(toModel(operation));
        }

        try {
            collection.bulkWrite(models, new BulkWriteOptions().ordered(false));
            return toOutcomes(operations, List.of());
        } catch (MongoBulkWriteException e) {
            if (e.getWriteConcernError() != null) {
                throw new StoreUnavailableException("Write concern not satisfied: " + e.getWriteConcernError().getMessage(), e);
            }
            logger.warn("Bulk write rejected {} of {} operations", e.getWriteErrors().size(), operations.size());
            return toOutcomes(operations, e.getWriteErrors());
        } catch (MongoException e) {
            throw new StoreUnavailableException("Bulk write failed", e);
        }
    }

    /**
     * Maps the driver's per-index write errors back onto the submitted operations.
     */
    static List<WriteOutcome> toOutcomes(List<GigWrite> operations, List<BulkWriteError> errors) {
        Map<Integer, BulkWriteError> errorsByIndex = new HashMap<>();
        for (BulkWriteError error : errors) {
            errorsByIndex.put(error.getIndex(), error);
        }

        List<WriteOutcome> outcomes = new ArrayList<>(operations.size());
        for (int i = 0; i < operations.size(); i++) {
            String key = operations.get(i).key();
            BulkWriteError error = errorsByIndex.get(i);
            outcomes.add(error == null
                ? WriteOutcome.ok(key)
                : WriteOutcome.failed(key, String.format("E%d: %s", error.getCode(), error.getMessage())));
        }
        return outcomes;
    }

    private WriteModel<Document> toModel(GigWrite operation) {
        Bson byKey = Filters.eq(DocumentMapper.IDENTITY_KEY, operation.key());
        Gig gig = operation.gig();
        if (operation.type() == GigWrite.Type.UPSERT) {
            return new ReplaceOneModel<>(byKey, DocumentMapper.toDocument(gig), new ReplaceOptions().upsert(true));
        }
        return new UpdateOneModel<>(byKey, Updates.combine(
            Updates.set(DocumentMapper.LAST_SEEN, DocumentMapper.toDate(gig.getLastSeen())),
            Updates.set(DocumentMapper.LAST_UPDATED, DocumentMapper.toDate(gig.getLastUpdated())),
            Updates.set(DocumentMapper.STALE, false),
            Updates.set(DocumentMapper.MISSED_RUNS, 0)));
    }

    @Override
    public int markMissing(String sourceId, Set<String> seenKeys, int staleAfterRuns) {
        Bson missing = Filters.and(
            Filters.eq(DocumentMapper.SOURCE_ID, sourceId),
            Filters.nin(DocumentMapper.IDENTITY_KEY, seenKeys));
        try {
            UpdateResult bumped = collection.updateMany(missing, Updates.inc(DocumentMapper.MISSED_RUNS, 1));
            UpdateResult flagged = collection.updateMany(
                Filters.and(missing,
                    Filters.eq(DocumentMapper.STALE, false),
                    Filters.gte(DocumentMapper.MISSED_RUNS, staleAfterRuns)),
                Updates.set(DocumentMapper.STALE, true));
            logger.debug("Source {}: {} gigs missing from this run, {} newly stale",
                sourceId, bumped.getModifiedCount(), flagged.getModifiedCount());
            return (int) flagged.getModifiedCount();
        } catch (MongoException e) {
            throw new StoreUnavailableException("Staleness update failed for source " + sourceId, e);
        }
    }

    @Override
    public Gig findByKey(String key) {
        if (key == null) {
            return null;
        }
        try {
            Document doc = collection.find(Filters.eq(DocumentMapper.IDENTITY_KEY, key)).first();
            return doc != null ? DocumentMapper.toGig(doc) : null;
        } catch (MongoException e) {
            throw new StoreUnavailableException("Lookup of gig " + key + " failed", e);
        }
    }
}
