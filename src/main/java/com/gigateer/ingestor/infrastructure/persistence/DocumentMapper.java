package com.gigateer.ingestor.infrastructure.persistence;

import com.gigateer.ingestor.domain.model.ErrorLogEntry;
import com.gigateer.ingestor.domain.model.ErrorStage;
import com.gigateer.ingestor.domain.model.Gig;
import com.gigateer.ingestor.domain.model.Performance;
import com.gigateer.ingestor.domain.model.PipelineStage;
import com.gigateer.ingestor.domain.model.PriceInfo;
import com.gigateer.ingestor.domain.model.RunCounts;
import com.gigateer.ingestor.domain.model.RunStatus;
import com.gigateer.ingestor.domain.model.ScraperRun;
import com.gigateer.ingestor.domain.model.Venue;
import org.bson.Document;
import org.bson.types.Decimal128;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts domain objects to and from BSON documents.
 *
 * <p>Instants are stored as BSON dates and prices as Decimal128 so the
 * collections can be queried and sorted natively.
 */
final class DocumentMapper {

    static final String IDENTITY_KEY = "identityKey";
    static final String FINGERPRINT = "fingerprint";
    static final String SOURCE_ID = "sourceId";
    static final String PROVENANCE = "provenance";
    static final String START_INSTANT = "startInstant";
    static final String FIRST_SEEN = "firstSeen";
    static final String LAST_SEEN = "lastSeen";
    static final String LAST_UPDATED = "lastUpdated";
    static final String STALE = "stale";
    static final String MISSED_RUNS = "missedRuns";

    static final String RUN_ID = "runId";
    static final String STARTED_AT = "startedAt";
    static final String TIMESTAMP = "timestamp";

    private DocumentMapper() {
    }

    static Document toDocument(Gig gig) {
        Document doc = new Document()
            .append(IDENTITY_KEY, gig.getIdentityKey())
            .append(FINGERPRINT, gig.getFingerprint())
            .append(SOURCE_ID, gig.getSourceId())
            .append(PROVENANCE, new ArrayList<>(gig.getProvenance()))
            .append("title", gig.getTitle())
            .append("canonicalTitle", gig.getCanonicalTitle())
            .append("venue", toDocument(gig.getVenue()))
            .append(START_INSTANT, toDate(gig.getStartInstant()))
            .append("endInstant", toDate(gig.getEndInstant()))
            .append("description", gig.getDescription())
            .append("ticketUrl", gig.getTicketUrl())
            .append("price", toDocument(gig.getPrice()))
            .append("contentHash", gig.getContentHash())
            .append(FIRST_SEEN, toDate(gig.getFirstSeen()))
            .append(LAST_SEEN, toDate(gig.getLastSeen()))
            .append(LAST_UPDATED, toDate(gig.getLastUpdated()))
            .append(STALE, gig.isStale())
            .append(MISSED_RUNS, gig.getMissedRuns());

        List<Document> performances = new ArrayList<>();
        for (Performance performance : gig.getPerformances()) {
            performances.add(new Document("parentKey", performance.parentKey())
                .append("occurrence", toDate(performance.occurrence())));
        }
        doc.append("performances", performances);
        return doc;
    }

    static Gig toGig(Document doc) {
        Gig gig = new Gig();
        gig.setIdentityKey(doc.getString(IDENTITY_KEY));
        gig.setFingerprint(doc.getString(FINGERPRINT));
        gig.setSourceId(doc.getString(SOURCE_ID));
        gig.setProvenance(new ArrayList<>(doc.getList(PROVENANCE, String.class, List.of())));
        gig.setTitle(doc.getString("title"));
        gig.setCanonicalTitle(doc.getString("canonicalTitle"));
        gig.setVenue(toVenue(doc.get("venue", Document.class)));
        gig.setStartInstant(toInstant(doc.getDate(START_INSTANT)));
        gig.setEndInstant(toInstant(doc.getDate("endInstant")));
        gig.setDescription(doc.getString("description"));
        gig.setTicketUrl(doc.getString("ticketUrl"));
        gig.setPrice(toPrice(doc.get("price", Document.class)));
        gig.setContentHash(doc.getString("contentHash"));
        gig.setFirstSeen(toInstant(doc.getDate(FIRST_SEEN)));
        gig.setLastSeen(toInstant(doc.getDate(LAST_SEEN)));
        gig.setLastUpdated(toInstant(doc.getDate(LAST_UPDATED)));
        gig.setStale(doc.getBoolean(STALE, false));
        gig.setMissedRuns(doc.getInteger(MISSED_RUNS, 0));

        List<Performance> performances = new ArrayList<>();
        for (Document performance : doc.getList("performances", Document.class, List.of())) {
            performances.add(new Performance(
                performance.getString("parentKey"), toInstant(performance.getDate("occurrence"))));
        }
        gig.setPerformances(performances);
        return gig;
    }

    static Document toDocument(ScraperRun run) {
        RunCounts counts = run.getCounts();
        return new Document(RUN_ID, run.getRunId())
            .append(SOURCE_ID, run.getSourceId())
            .append(STARTED_AT, toDate(run.getStartedAt()))
            .append("endedAt", toDate(run.getEndedAt()))
            .append("status", run.getStatus().getKey())
            .append("stage", run.getStage().name())
            .append("counts", new Document("scraped", counts.getScraped())
                .append("created", counts.getCreated())
                .append("updated", counts.getUpdated())
                .append("unchanged", counts.getUnchanged())
                .append("failed", counts.getFailed())
                .append("skipped", counts.getSkipped()))
            .append("error", run.getError())
            .append("durationMs", run.getDurationMs());
    }

    static ScraperRun toRun(Document doc) {
        ScraperRun run = new ScraperRun(doc.getString(RUN_ID), doc.getString(SOURCE_ID), toInstant(doc.getDate(STARTED_AT)));
        run.setEndedAt(toInstant(doc.getDate("endedAt")));
        run.setStatus(RunStatus.fromKey(doc.getString("status")));
        run.setStage(PipelineStage.valueOf(doc.getString("stage")));
        Document counts = doc.get("counts", Document.class);
        if (counts != null) {
            run.setCounts(new RunCounts(
                counts.getInteger("scraped", 0),
                counts.getInteger("created", 0),
                counts.getInteger("updated", 0),
                counts.getInteger("unchanged", 0),
                counts.getInteger("failed", 0),
                counts.getInteger("skipped", 0)));
        }
        run.setError(doc.getString("error"));
        Number duration = doc.get("durationMs", Number.class);
        run.setDurationMs(duration != null ? duration.longValue() : 0L);
        return run;
    }

    static Document toDocument(ErrorLogEntry entry) {
        return new Document(RUN_ID, entry.runId())
            .append(SOURCE_ID, entry.sourceId())
            .append("stage", entry.stage().getKey())
            .append("errorKind", entry.errorKind())
            .append("message", entry.message())
            .append(IDENTITY_KEY, entry.identityKey())
            .append("rawPayload", new Document(entry.rawPayload()))
            .append(TIMESTAMP, toDate(entry.timestamp()));
    }

    static ErrorLogEntry toErrorLogEntry(Document doc) {
        Document raw = doc.get("rawPayload", Document.class);
        Map<String, Object> payload = raw != null ? new LinkedHashMap<>(raw) : Map.of();
        return new ErrorLogEntry(
            doc.getString(RUN_ID),
            doc.getString(SOURCE_ID),
            ErrorStage.fromKey(doc.getString("stage")),
            doc.getString("errorKind"),
            doc.getString("message"),
            doc.getString(IDENTITY_KEY),
            payload,
            toInstant(doc.getDate(TIMESTAMP)));
    }

    private static Document toDocument(Venue venue) {
        if (venue == null) {
            return null;
        }
        return new Document("name", venue.getName())
            .append("address", venue.getAddress())
            .append("locality", venue.getLocality())
            .append("slug", venue.getSlug());
    }

    private static Venue toVenue(Document doc) {
        if (doc == null) {
            return null;
        }
        return new Venue(doc.getString("name"), doc.getString("address"), doc.getString("locality"), doc.getString("slug"));
    }

    private static Document toDocument(PriceInfo price) {
        if (price == null) {
            return null;
        }
        return new Document("min", toDecimal(price.getMin()))
            .append("max", toDecimal(price.getMax()))
            .append("currency", price.getCurrency())
            .append("text", price.getText());
    }

    private static PriceInfo toPrice(Document doc) {
        if (doc == null) {
            return null;
        }
        PriceInfo price = new PriceInfo();
        price.setMin(fromDecimal(doc.get("min", Decimal128.class)));
        price.setMax(fromDecimal(doc.get("max", Decimal128.class)));
        price.setCurrency(doc.getString("currency"));
        price.setText(doc.getString("text"));
        return price;
    }

    private static Decimal128 toDecimal(BigDecimal value) {
        return value != null ? new Decimal128(value) : null;
    }

    private static BigDecimal fromDecimal(Decimal128 value) {
        return value != null ? value.bigDecimalValue() : null;
    }

    static Date toDate(Instant instant) {
        return instant != null ? Date.from(instant) : null;
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : null;
    }
}
