package com.gigateer.ingestor.infrastructure.persistence;

import com.gigateer.ingestor.domain.model.ErrorLogEntry;
import com.gigateer.ingestor.domain.model.ErrorStage;
import com.gigateer.ingestor.domain.model.Gig;
import com.gigateer.ingestor.domain.model.Performance;
import com.gigateer.ingestor.domain.model.PipelineStage;
import com.gigateer.ingestor.domain.model.PriceInfo;
import com.gigateer.ingestor.domain.model.RunStatus;
import com.gigateer.ingestor.domain.model.ScraperRun;
import com.gigateer.ingestor.domain.model.Venue;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DocumentMapper.
 */
class DocumentMapperTest {

    private static final Instant START = Instant.parse("2025-06-01T19:00:00Z");

    @Test
    void testGigStoredWithNativeTypes() {
        Gig gig = new Gig();
        gig.setIdentityKey("key-1");
        gig.setFingerprint("fp-1");
        gig.setSourceId("bristol-the-croft");
        gig.setProvenance(List.of("bristol-exchange"));
        gig.setTitle("Band A");
        gig.setCanonicalTitle("band a");
        gig.setVenue(new Venue("The Croft", null, "Bristol", "the-croft"));
        gig.setStartInstant(START);
        PriceInfo price = new PriceInfo();
        price.setMin(new BigDecimal("10.50"));
        price.setMax(new BigDecimal("12.00"));
        price.setCurrency("GBP");
        price.setText("£10.50 / £12");
        gig.setPrice(price);
        gig.setPerformances(List.of(new Performance("key-1", START)));
        gig.setMissedRuns(2);

        Document doc = DocumentMapper.toDocument(gig);

        assertEquals(Date.from(START), doc.getDate("startInstant"));
        assertNull(doc.get("endInstant"));
        assertEquals(new Decimal128(new BigDecimal("10.50")), doc.get("price", Document.class).get("min"));
        assertEquals("the-croft", doc.get("venue", Document.class).getString("slug"));

        Gig read = DocumentMapper.toGig(doc);
        assertEquals("key-1", read.getIdentityKey());
        assertEquals(List.of("bristol-exchange"), read.getProvenance());
        assertEquals(START, read.getStartInstant());
        assertEquals(new BigDecimal("10.50"), read.getPrice().getMin());
        assertEquals(START, read.getPerformances().get(0).occurrence());
        assertEquals(2, read.getMissedRuns());
        assertFalse(read.isStale());
    }

    @Test
    void testRunStatusStoredByKey() {
        ScraperRun run = new ScraperRun("run-1", "bristol-the-croft", START);
        run.setStatus(RunStatus.PARTIAL);
        run.setStage(PipelineStage.PARTIALLY_FAILED);
        run.getCounts().addScraped(3);
        run.getCounts().addCreated(2);
        run.getCounts().addFailed(1);
        run.setDurationMs(1234L);

        Document doc = DocumentMapper.toDocument(run);
        assertEquals("partial", doc.getString("status"));

        ScraperRun read = DocumentMapper.toRun(doc);
        assertEquals(RunStatus.PARTIAL, read.getStatus());
        assertEquals(PipelineStage.PARTIALLY_FAILED, read.getStage());
        assertEquals(3, read.getCounts().getScraped());
        assertTrue(read.getCounts().isBalanced());
        assertEquals(1234L, read.getDurationMs());
    }

    @Test
    void testErrorLogEntryKeepsRawPayload() {
        ErrorLogEntry entry = new ErrorLogEntry("run-1", "bristol-the-croft", ErrorStage.NORMALIZE, "INVALID_DATE",
            "Unparseable start date", null, Map.of("sourceId", "bristol-the-croft", "fields", Map.of("start", "soon")), START);

        Document doc = DocumentMapper.toDocument(entry);
        assertEquals("normalize", doc.getString("stage"));

        ErrorLogEntry read = DocumentMapper.toErrorLogEntry(doc);
        assertEquals(ErrorStage.NORMALIZE, read.stage());
        assertEquals("bristol-the-croft", read.rawPayload().get("sourceId"));
        assertEquals(START, read.timestamp());
    }
}
