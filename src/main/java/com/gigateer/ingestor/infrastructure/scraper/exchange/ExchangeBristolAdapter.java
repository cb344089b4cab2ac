package com.gigateer.ingestor.infrastructure.scraper.exchange;

import com.gigateer.ingestor.domain.model.RawRecord;
import com.gigateer.ingestor.domain.model.RawRecord.Fields;
import com.gigateer.ingestor.infrastructure.scraper.HtmlFetcher;
import com.gigateer.ingestor.infrastructure.scraper.HtmlListingAdapter;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter for Exchange, Bristol (HeadFirst ticketing listings).
 *
 * Each {@code div.event-listing} carries a machine readable start in
 * {@code time[datetime]}. Residencies and multi-night runs list every
 * date under {@code ul.event-listing__dates}; those become occurrences.
 */
@Component
public class ExchangeBristolAdapter extends HtmlListingAdapter {

    static final String SOURCE_ID = "bristol-exchange";
    private static final String VENUE_NAME = "Exchange Bristol";
    private static final String VENUE_ADDRESS = "72-73 Old Market St, Bristol BS2 0EJ";
    private static final String LOCALITY = "Bristol";

    public ExchangeBristolAdapter() {
        super();
    }

    ExchangeBristolAdapter(HtmlFetcher fetcher) {
        super(fetcher);
    }

    @Override
    public String getSourceId() {
        return SOURCE_ID;
    }

    @Override
    protected String cardSelector() {
        return "div.event-listing";
    }

    @Override
    protected RawRecord extract(Element card) {
        List<String> occurrences = new ArrayList<>();
        for (Element date : card.select("ul.event-listing__dates time[datetime]")) {
            occurrences.add(date.attr("datetime"));
        }

        Element start = card.selectFirst(".event-listing__when time[datetime]");
        if (start == null && occurrences.isEmpty()) {
            throw new IllegalStateException("event listing has no machine readable date");
        }

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(Fields.TITLE, text(card, ".event-listing__title"));
        fields.put(Fields.VENUE, VENUE_NAME);
        fields.put(Fields.VENUE_ADDRESS, VENUE_ADDRESS);
        fields.put(Fields.LOCALITY, LOCALITY);
        if (start != null) {
            fields.put(Fields.START, start.attr("datetime"));
        }
        fields.put(Fields.DESCRIPTION, text(card, ".event-listing__support"));
        fields.put(Fields.PRICE, text(card, ".event-listing__price"));
        fields.put(Fields.TICKET_URL, absoluteUrl(card, "a.event-listing__tickets", "href"));
        fields.values().removeIf(value -> value == null);
        return new RawRecord(SOURCE_ID, fields, occurrences, null);
    }
}
