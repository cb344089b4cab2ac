package com.gigateer.ingestor.application.persistence;

import com.gigateer.ingestor.application.dedup.IdentityKeys;
import com.gigateer.ingestor.application.run.RunDeadline;
import com.gigateer.ingestor.domain.exception.RunTimeoutException;
import com.gigateer.ingestor.domain.exception.StoreUnavailableException;
import com.gigateer.ingestor.domain.model.BulkOperationResult;
import com.gigateer.ingestor.domain.model.ClassifiedGig;
import com.gigateer.ingestor.domain.model.Gig;
import com.gigateer.ingestor.domain.model.MergeAction;
import com.gigateer.ingestor.domain.model.RawRecord;
import com.gigateer.ingestor.domain.model.Venue;
import com.gigateer.ingestor.support.InMemoryGigRepository;
import com.gigateer.ingestor.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PersistenceCoordinator.
 */
class PersistenceCoordinatorTest {

    private static final Instant NOW = Instant.parse("2025-05-01T10:00:00Z");

    private InMemoryGigRepository repository;
    private PersistenceCoordinator coordinator;
    private MutableClock clock;
    private RunDeadline deadline;

    @BeforeEach
    void setUp() {
        repository = new InMemoryGigRepository();
        coordinator = new PersistenceCoordinator(repository);
        clock = new MutableClock(NOW);
        deadline = new RunDeadline(clock, NOW, 60_000L);
    }

    private static ClassifiedGig classified(String title, MergeAction action) {
        Gig gig = new Gig();
        gig.setSourceId("croft");
        gig.setTitle(title);
        gig.setCanonicalTitle(title.toLowerCase());
        gig.setVenue(new Venue("The Croft", null, null, "the-croft"));
        gig.setStartInstant(Instant.parse("2025-06-01T19:00:00Z"));
        gig.setFirstSeen(NOW);
        gig.setLastSeen(NOW);
        gig.setLastUpdated(NOW);
        IdentityKeys.assign(gig);
        return new ClassifiedGig(gig, action, RawRecord.of("croft", Map.of("title", title)));
    }

    @Test
    void testCountsPerAction() throws Exception {
        ClassifiedGig unchanged = classified("Band C", MergeAction.UNCHANGED);
        repository.put(unchanged.gig());

        BulkOperationResult result = coordinator.persist(List.of(
            classified("Band A", MergeAction.CREATE),
            classified("Band B", MergeAction.UPDATE),
            unchanged,
            classified("Band A", MergeAction.SKIP)), 500, deadline);

        assertEquals(1, result.created());
        assertEquals(1, result.updated());
        assertEquals(1, result.unchanged());
        assertTrue(result.failed().isEmpty());
        assertEquals(List.of(3), repository.getBulkSizes());
        assertEquals(3, repository.size());
    }

    @Test
    void testChunksRespectBatchSizeLimit() throws Exception {
        List<ClassifiedGig> batch = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            batch.add(classified("Band " + i, MergeAction.CREATE));
        }

        BulkOperationResult result = coordinator.persist(batch, 3, deadline);

        assertEquals(7, result.created());
        assertEquals(List.of(3, 3, 1), repository.getBulkSizes());
    }

    @Test
    void testRejectedWriteIsIsolated() throws Exception {
        ClassifiedGig bad = classified("Band B", MergeAction.CREATE);
        repository.rejectWritesFor(bad.key());

        BulkOperationResult result = coordinator.persist(List.of(
            classified("Band A", MergeAction.CREATE), bad, classified("Band C", MergeAction.CREATE)), 500, deadline);

        assertEquals(2, result.created());
        assertEquals(1, result.failed().size());
        assertEquals(bad.key(), result.failed().get(0).key());
        assertSame(bad.raw(), result.failed().get(0).raw());
        assertTrue(result.failed().get(0).error().contains("E11000"));
        assertNull(repository.findByKey(bad.key()));
    }

    @Test
    void testEmptyBatchWritesNothing() throws Exception {
        BulkOperationResult result = coordinator.persist(List.of(classified("Band A", MergeAction.SKIP)), 500, deadline);

        assertEquals(0, result.created() + result.updated() + result.unchanged());
        assertTrue(repository.getBulkSizes().isEmpty());
    }

    @Test
    void testDeadlineStopsBeforeNextChunk() {
        List<ClassifiedGig> batch = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            batch.add(classified("Band " + i, MergeAction.CREATE));
        }
        List<BulkOperationResult> committed = new ArrayList<>();

        assertThrows(RunTimeoutException.class, () -> coordinator.persist(batch, 2, deadline, chunk -> {
            committed.add(chunk);
            clock.advance(Duration.ofMinutes(5));
        }));

        assertEquals(1, committed.size());
        assertEquals(2, committed.get(0).created());
        assertEquals(2, repository.size());
    }

    @Test
    void testStoreOutagePropagates() {
        repository.setUnavailable(true);
        assertThrows(StoreUnavailableException.class,
            () -> coordinator.persist(List.of(classified("Band A", MergeAction.CREATE)), 500, deadline));
    }
}
