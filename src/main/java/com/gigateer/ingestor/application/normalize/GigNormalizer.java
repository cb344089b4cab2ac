package com.gigateer.ingestor.application.normalize;

import com.gigateer.ingestor.application.dedup.IdentityKeys;
import com.gigateer.ingestor.domain.exception.NormalizationException;
import com.gigateer.ingestor.domain.model.Gig;
import com.gigateer.ingestor.domain.model.Performance;
import com.gigateer.ingestor.domain.model.RawRecord;
import com.gigateer.ingestor.domain.model.RawRecord.Fields;
import com.gigateer.ingestor.domain.model.SourceConfig;
import com.gigateer.ingestor.domain.model.Venue;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps raw adapter records onto the canonical {@link Gig} shape.
 *
 * <p>Has no side effects: the result depends only on the record, the
 * source configuration and the injected clock (for relative dates).
 */
public class GigNormalizer {

    private final RawDateParser dateParser;
    private final ContentHasher contentHasher;
    private final Map<Map<String, String>, VenueCanonicalizer> canonicalizers = new ConcurrentHashMap<>();

    public GigNormalizer(RawDateParser dateParser, ContentHasher contentHasher) {
        this.dateParser = dateParser;
        this.contentHasher = contentHasher;
    }

    /**
     * Normalizes one record.
     *
     * @throws NormalizationException if a required field is missing, a date
     *                                cannot be parsed or the venue has no canonical form
     */
    public Gig normalize(RawRecord raw, SourceConfig config) throws NormalizationException {
        String title = NormalizationUtils.collapseWhitespace(raw.field(Fields.TITLE));
        if (title == null) {
            throw NormalizationException.missingField(Fields.TITLE);
        }
        String canonicalTitle = NormalizationUtils.canonicalText(title);
        if (canonicalTitle.isEmpty()) {
            // punctuation-only names such as "!!!" are still names
            canonicalTitle = title.toLowerCase(Locale.ROOT);
        }

        String venueName = NormalizationUtils.collapseWhitespace(raw.field(Fields.VENUE));
        if (venueName == null) {
            throw NormalizationException.missingField(Fields.VENUE);
        }

        String rawStart = NormalizationUtils.collapseWhitespace(raw.field(Fields.START));
        if (rawStart == null && raw.occurrences().isEmpty()) {
            throw NormalizationException.missingField(Fields.START);
        }

        List<Instant> occurrences = new ArrayList<>();
        for (String occurrence : raw.occurrences()) {
            occurrences.add(dateParser.parse("occurrence", occurrence, config));
        }
        occurrences.sort(null);

        Instant start = rawStart != null
            ? dateParser.parse(Fields.START, rawStart, config)
            : occurrences.get(0);

        Instant end = null;
        String rawEnd = NormalizationUtils.collapseWhitespace(raw.field(Fields.END));
        if (rawEnd != null) {
            end = dateParser.parse(Fields.END, rawEnd, config);
            if (end.isBefore(start)) {
                throw new NormalizationException(NormalizationException.Kind.INVALID_DATE,
                    String.format("End %s is before start %s", end, start));
            }
        }

        String slug = canonicalizers
            .computeIfAbsent(config.venueAliasTable(), VenueCanonicalizer::new)
            .toSlug(venueName);
        if (slug.isEmpty()) {
            throw NormalizationException.invalidVenue(venueName);
        }

        Gig gig = new Gig();
        gig.setSourceId(config.sourceId());
        gig.setTitle(title);
        gig.setCanonicalTitle(canonicalTitle);
        gig.setVenue(new Venue(
            venueName,
            NormalizationUtils.collapseWhitespace(raw.field(Fields.VENUE_ADDRESS)),
            NormalizationUtils.collapseWhitespace(raw.field(Fields.LOCALITY)),
            slug));
        gig.setStartInstant(start);
        gig.setEndInstant(end);
        gig.setDescription(NormalizationUtils.collapseWhitespace(raw.field(Fields.DESCRIPTION)));
        gig.setTicketUrl(httpUrlOrNull(raw.field(Fields.TICKET_URL)));
        gig.setPrice(PriceParser.parse(raw.field(Fields.PRICE)));

        IdentityKeys.assign(gig);

        List<Performance> performances = new ArrayList<>();
        for (Instant occurrence : occurrences) {
            performances.add(new Performance(gig.getIdentityKey(), occurrence));
        }
        gig.setPerformances(performances);

        gig.setContentHash(contentHasher.hash(gig));
        return gig;
    }

    private static String httpUrlOrNull(String raw) {
        String value = raw != null ? raw.trim() : null;
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
            if ((scheme.equals("http") || scheme.equals("https")) && uri.getHost() != null) {
                return uri.toString();
            }
            return null;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
