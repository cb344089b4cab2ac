package com.gigateer.ingestor.infrastructure.scraper.croft;

import com.gigateer.ingestor.domain.model.RawRecord;
import com.gigateer.ingestor.domain.model.RawRecord.Fields;
import com.gigateer.ingestor.infrastructure.scraper.HtmlFetcher;
import com.gigateer.ingestor.infrastructure.scraper.HtmlListingAdapter;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Adapter for The Croft, Bristol.
 *
 * Listing page layout:
 * - one {@code article.event-card} per gig
 * - date ("Fri 14 Mar 2025") and door time ("7:30pm") in separate elements
 * - optional room name ({@code data-room}) for the Front Bar and main room
 */
@Component
public class TheCroftBristolAdapter extends HtmlListingAdapter {

    static final String SOURCE_ID = "bristol-the-croft";
    private static final String VENUE_NAME = "The Croft";
    private static final String VENUE_ADDRESS = "117-119 Stokes Croft, Bristol BS1 3RW";
    private static final String LOCALITY = "Bristol";

    public TheCroftBristolAdapter() {
        super();
    }

    TheCroftBristolAdapter(HtmlFetcher fetcher) {
        super(fetcher);
    }

    @Override
    public String getSourceId() {
        return SOURCE_ID;
    }

    @Override
    protected String cardSelector() {
        return "article.event-card";
    }

    @Override
    protected RawRecord extract(Element card) {
        String link = absoluteUrl(card, "a.event-link", "href");
        if (link == null) {
            throw new IllegalStateException("event card has no event link");
        }

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(Fields.TITLE, text(card, ".event-title"));
        String room = card.attr("data-room");
        fields.put(Fields.VENUE, room.isBlank() ? VENUE_NAME : VENUE_NAME + " " + room);
        fields.put(Fields.VENUE_ADDRESS, VENUE_ADDRESS);
        fields.put(Fields.LOCALITY, LOCALITY);
        fields.put(Fields.START, joinNonNull(" ", text(card, ".event-date"), text(card, ".event-time")));
        fields.put(Fields.DESCRIPTION, joinNonNull(" | ", text(card, ".event-support"), text(card, ".event-genre")));
        fields.put(Fields.PRICE, text(card, ".event-price"));
        String tickets = absoluteUrl(card, "a.event-tickets", "href");
        fields.put(Fields.TICKET_URL, tickets != null ? tickets : link);
        fields.put("eventUrl", link);
        fields.values().removeIf(value -> value == null);
        return RawRecord.of(SOURCE_ID, fields);
    }
}
