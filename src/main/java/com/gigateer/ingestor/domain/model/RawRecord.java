package com.gigateer.ingestor.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Candidate gig exactly as a source adapter extracted it.
 *
 * <p>Field names understood by the normalizer are listed in {@link Fields}.
 * Adapters may add any other source-specific field; those are kept in the
 * error log snapshot but otherwise ignored.
 *
 * @param sourceId        adapter that produced the record
 * @param fields          extracted text fields
 * @param occurrences     raw dates of a repeating event, empty for a one-off gig
 * @param extractionError set when the adapter found a listing it could not read
 */
public record RawRecord(
    String sourceId,
    Map<String, String> fields,
    List<String> occurrences,
    String extractionError
) {

    public RawRecord {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
    }

    public static RawRecord of(String sourceId, Map<String, String> fields) {
        return new RawRecord(sourceId, fields, List.of(), null);
    }

    public static RawRecord failed(String sourceId, Map<String, String> partialFields, String error) {
        return new RawRecord(sourceId, partialFields, List.of(), error);
    }

    public String field(String name) {
        return fields.get(name);
    }

    public boolean isExtractionFailure() {
        return extractionError != null;
    }

    /**
     * Field names shared by all adapters.
     */
    public static final class Fields {
        public static final String TITLE = "title";
        public static final String VENUE = "venue";
        public static final String VENUE_ADDRESS = "venueAddress";
        public static final String LOCALITY = "locality";
        public static final String START = "start";
        public static final String END = "end";
        public static final String DESCRIPTION = "description";
        public static final String TICKET_URL = "ticketUrl";
        public static final String PRICE = "price";

        private Fields() {
        }
    }
}
