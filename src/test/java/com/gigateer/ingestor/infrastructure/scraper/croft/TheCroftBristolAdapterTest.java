package com.gigateer.ingestor.infrastructure.scraper.croft;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gigateer.ingestor.application.normalize.ContentHasher;
import com.gigateer.ingestor.application.normalize.GigNormalizer;
import com.gigateer.ingestor.application.normalize.RawDateParser;
import com.gigateer.ingestor.domain.exception.FetchException;
import com.gigateer.ingestor.domain.model.Gig;
import com.gigateer.ingestor.domain.model.RawRecord;
import com.gigateer.ingestor.domain.model.RawRecord.Fields;
import com.gigateer.ingestor.domain.model.SourceConfig;
import com.gigateer.ingestor.infrastructure.scraper.Fixtures;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TheCroftBristolAdapterTest {

    private static final String LISTING_URL = "https://www.thecroftbristol.com/events";

    private final SourceConfig config = new SourceConfig(TheCroftBristolAdapter.SOURCE_ID, LISTING_URL,
        ZoneId.of("Europe/London"), LocalTime.of(20, 0), Map.of("The Croft Front Bar", "The Croft"),
        List.of("EEE d MMM yyyy h:mma", "EEE d MMM yyyy h.mma", "EEE d MMM yyyy ha", "EEE d MMM yyyy"),
        500, 300_000L, 3);

    private List<RawRecord> fetch(String html) throws FetchException {
        List<String> requested = new ArrayList<>();
        TheCroftBristolAdapter adapter = new TheCroftBristolAdapter(url -> {
            requested.add(url);
            return html;
        });
        List<RawRecord> records = adapter.fetchListings(config).collect(Collectors.toList());
        assertEquals(List.of(LISTING_URL), requested);
        return records;
    }

    @Test
    void testExtractsEveryEventCard() throws Exception {
        List<RawRecord> records = fetch(Fixtures.html("croft-listing.html"));

        assertEquals(4, records.size());

        RawRecord first = records.get(0);
        assertFalse(first.isExtractionFailure());
        assertEquals("bristol-the-croft", first.sourceId());
        assertEquals("The Lovely Eggs", first.field(Fields.TITLE));
        assertEquals("The Croft", first.field(Fields.VENUE));
        assertEquals("Fri 14 Mar 2025 7:30pm", first.field(Fields.START));
        assertEquals("+ Bug Teeth | Psych / Punk", first.field(Fields.DESCRIPTION));
        assertEquals("£14.50", first.field(Fields.PRICE));
        assertEquals("https://tickets.example.com/croft/lovely-eggs", first.field(Fields.TICKET_URL));
        assertEquals("https://www.thecroftbristol.com/events/the-lovely-eggs", first.field("eventUrl"));

        RawRecord frontBar = records.get(1);
        assertEquals("The Croft Front Bar", frontBar.field(Fields.VENUE));
        assertEquals("Sat 15 Mar 2025", frontBar.field(Fields.START));
        assertNull(frontBar.field(Fields.DESCRIPTION));
        assertEquals("https://www.thecroftbristol.com/events/open-mic", frontBar.field(Fields.TICKET_URL));
    }

    @Test
    void testCardWithoutLinkBecomesExtractionFailure() throws Exception {
        RawRecord broken = fetch(Fixtures.html("croft-listing.html")).get(2);

        assertTrue(broken.isExtractionFailure());
        assertEquals("event card has no event link", broken.extractionError());
        assertTrue(broken.field("html").contains("Private Hire"));
    }

    @Test
    void testExtractedCardsNormalize() throws Exception {
        List<RawRecord> records = fetch(Fixtures.html("croft-listing.html"));
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
        GigNormalizer normalizer = new GigNormalizer(new RawDateParser(clock), new ContentHasher(new ObjectMapper()));

        Gig eggs = normalizer.normalize(records.get(0), config);
        assertEquals(Instant.parse("2025-03-14T19:30:00Z"), eggs.getStartInstant());
        assertEquals(0, new BigDecimal("14.50").compareTo(eggs.getPrice().getMin()));

        Gig openMic = normalizer.normalize(records.get(1), config);
        assertEquals(Instant.parse("2025-03-15T20:00:00Z"), openMic.getStartInstant());
        assertEquals(eggs.getVenue().getSlug(), openMic.getVenue().getSlug());

        RawRecord september = records.get(3);
        assertEquals("Fri 12 Sep 2025 8pm", september.field(Fields.START));
        Gig heavyLungs = normalizer.normalize(september, config);
        assertEquals(Instant.parse("2025-09-12T19:00:00Z"), heavyLungs.getStartInstant());
    }

    @Test
    void testEmptyPageYieldsNoRecords() throws Exception {
        assertTrue(fetch("<html><body><p>No events</p></body></html>").isEmpty());
    }

    @Test
    void testFetchErrorIsReported() {
        TheCroftBristolAdapter adapter = new TheCroftBristolAdapter(url -> {
            throw new IOException("HTTP 503 from " + url);
        });

        FetchException e = assertThrows(FetchException.class, () -> adapter.fetchListings(config));
        assertEquals("bristol-the-croft", e.getSourceId());
        assertTrue(e.getMessage().contains("HTTP 503"));
    }

    @Test
    void testMissingListingUrlIsReported() {
        TheCroftBristolAdapter adapter = new TheCroftBristolAdapter(url -> fail("should not fetch"));

        assertThrows(FetchException.class,
            () -> adapter.fetchListings(SourceConfig.withDefaults(TheCroftBristolAdapter.SOURCE_ID, ZoneId.of("Europe/London"))));
    }
}
