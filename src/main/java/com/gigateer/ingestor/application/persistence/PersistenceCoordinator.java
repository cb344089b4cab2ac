package com.gigateer.ingestor.application.persistence;

import com.gigateer.ingestor.application.run.RunDeadline;
import com.gigateer.ingestor.domain.exception.RunTimeoutException;
import com.gigateer.ingestor.domain.model.BulkOperationResult;
import com.gigateer.ingestor.domain.model.BulkOperationResult.FailedWrite;
import com.gigateer.ingestor.domain.model.ClassifiedGig;
import com.gigateer.ingestor.domain.model.MergeAction;
import com.gigateer.ingestor.domain.model.PipelineStage;
import com.gigateer.ingestor.domain.ports.GigRepository;
import com.gigateer.ingestor.domain.ports.GigRepository.GigWrite;
import com.gigateer.ingestor.domain.ports.GigRepository.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Turns classified gigs into bulk writes and submits them in chunks.
 *
 * <p>Chunks are sent one after the other. A rejected write is reported for
 * its own record only; the rest of the chunk and all later chunks still go
 * through. {@link com.gigateer.ingestor.domain.exception.StoreUnavailableException}
 * from the repository is not caught here.
 */
public class PersistenceCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(PersistenceCoordinator.class);

    private final GigRepository gigRepository;

    public PersistenceCoordinator(GigRepository gigRepository) {
        this.gigRepository = gigRepository;
    }

    public BulkOperationResult persist(List<ClassifiedGig> classified, int batchSizeLimit, RunDeadline deadline)
            throws RunTimeoutException {
        return persist(classified, batchSizeLimit, deadline, chunk -> { });
    }

    /**
     * @param classified     deduplicated gigs; SKIP entries are ignored
     * @param batchSizeLimit maximum writes per bulk request
     * @param deadline       checked before each chunk
     * @param onChunk        receives the result of every committed chunk, so
     *                       callers keep exact counts even if a later chunk times out
     * @return totals over all chunks
     */
    public BulkOperationResult persist(
            List<ClassifiedGig> classified,
            int batchSizeLimit,
            RunDeadline deadline,
            Consumer<BulkOperationResult> onChunk) throws RunTimeoutException {

        if (batchSizeLimit <= 0) {
            throw new IllegalArgumentException("batchSizeLimit must be positive");
        }

        List<ClassifiedGig> writable = new ArrayList<>();
        for (ClassifiedGig gig : classified) {
            if (gig.action() != MergeAction.SKIP) {
                writable.add(gig);
            }
        }
        if (writable.isEmpty()) {
            return BulkOperationResult.empty();
        }

        int created = 0;
        int updated = 0;
        int unchanged = 0;
        List<FailedWrite> failed = new ArrayList<>();

        for (int i = 0; i < writable.size(); i += batchSizeLimit) {
            deadline.check(PipelineStage.PERSISTING);

            List<ClassifiedGig> chunk = writable.subList(i, Math.min(i + batchSizeLimit, writable.size()));
            BulkOperationResult chunkResult = writeChunk(chunk);
            onChunk.accept(chunkResult);

            created += chunkResult.created();
            updated += chunkResult.updated();
            unchanged += chunkResult.unchanged();
            failed.addAll(chunkResult.failed());
        }

        logger.info("Persisted {} gigs in chunks of {}: created={} updated={} unchanged={} failed={}",
            writable.size(), batchSizeLimit, created, updated, unchanged, failed.size());
        return new BulkOperationResult(created, updated, unchanged, failed);
    }

    private BulkOperationResult writeChunk(List<ClassifiedGig> chunk) {
        List<GigWrite> writes = new ArrayList<>(chunk.size());
        for (ClassifiedGig gig : chunk) {
            GigWrite.Type type = gig.action() == MergeAction.UNCHANGED ? GigWrite.Type.TOUCH : GigWrite.Type.UPSERT;
            writes.add(new GigWrite(gig.gig(), type));
        }

        List<WriteOutcome> outcomes = gigRepository.bulkUpsert(writes);
        if (outcomes.size() != writes.size()) {
            throw new IllegalStateException(String.format(
                "Repository returned %d outcomes for %d writes", outcomes.size(), writes.size()));
        }

        int created = 0;
        int updated = 0;
        int unchanged = 0;
        List<FailedWrite> failed = new ArrayList<>();

        for (int i = 0; i < chunk.size(); i++) {
            ClassifiedGig gig = chunk.get(i);
            WriteOutcome outcome = outcomes.get(i);
            if (!outcome.success()) {
                failed.add(new FailedWrite(gig.key(), gig.raw(), outcome.error()));
                continue;
            }
            switch (gig.action()) {
                case CREATE:
                    created++;
                    break;
                case UPDATE:
                    updated++;
                    break;
                default:
                    unchanged++;
                    break;
            }
        }

        if (!failed.isEmpty()) {
            logger.warn("{} of {} writes rejected in chunk", failed.size(), chunk.size());
        }
        return new BulkOperationResult(created, updated, unchanged, failed);
    }
}
